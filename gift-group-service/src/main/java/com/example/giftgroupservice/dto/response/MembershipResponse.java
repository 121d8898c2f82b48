package com.example.giftgroupservice.dto.response;

import com.example.giftgroupservice.entity.MembershipState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a membership transition.
 * state is null when the membership row no longer exists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MembershipResponse {

    private Long groupId;
    private Long userId;
    private MembershipState state;
    private ActionOutcome outcome;

    /**
     * Rows removed by the member-removal cascade when the row was deleted.
     */
    private CascadeReport cascade;
}
