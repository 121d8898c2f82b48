package com.example.giftgroupservice.dto.response;

import com.example.giftgroupservice.entity.Membership;
import com.example.giftgroupservice.entity.MembershipState;
import com.example.giftgroupservice.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One membership row as shown in group and manage views.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberResponse {

    private Long userId;
    private String username;
    private Long groupId;
    private MembershipState state;
    private Long selectedListId;
    private String selectedListName;
    private Instant joinedAt;

    /**
     * Create MemberResponse from a membership and its user (user may be null after deletion).
     */
    public static MemberResponse from(Membership membership, User user, String selectedListName) {
        return MemberResponse.builder()
                .userId(membership.getUserId())
                .username(user != null ? user.getUsername() : "<Deleted User>")
                .groupId(membership.getGroupId())
                .state(membership.getState())
                .selectedListId(membership.getSelectedListId())
                .selectedListName(selectedListName)
                .joinedAt(membership.getCreatedAt())
                .build();
    }
}
