package com.example.giftgroupservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Account dashboard.
 * groupsForList: for each of the user's lists, the groups it is shown in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardResponse {

    private UserResponse user;
    private List<GiftListResponse> lists;
    private List<MyGroupResponse> groups;
    private Map<Long, List<GroupResponse>> groupsForList;
    private List<ClaimResponse> giftsImGiving;
}
