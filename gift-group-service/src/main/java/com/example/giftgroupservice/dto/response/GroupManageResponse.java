package com.example.giftgroupservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Leader's management page: memberships grouped by state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupManageResponse {

    private GroupResponse group;
    private List<MemberResponse> pendingRequests;
    private List<MemberResponse> pendingInvites;
    private List<MemberResponse> denied;
    private List<MemberResponse> approved;
}
