package com.example.giftgroupservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimResultResponse {

    private Long itemId;
    private Long groupId;
    private Long claimerId;
    private ActionOutcome outcome;
}
