package com.example.giftgroupservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A claim with enough context for the "gifts I'm giving" dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimResponse {

    private Long claimId;
    private Long itemId;
    private String itemName;
    private Long listId;
    private String listName;
    private Long recipientId;
    private Long groupId;
    private String groupName;
    private Instant claimedAt;
}
