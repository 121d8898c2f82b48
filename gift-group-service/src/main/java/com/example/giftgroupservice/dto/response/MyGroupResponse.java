package com.example.giftgroupservice.dto.response;

import com.example.giftgroupservice.entity.MembershipState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A group as seen from one user's membership.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MyGroupResponse {

    private GroupResponse group;
    private MembershipState state;
    private Long selectedListId;
}
