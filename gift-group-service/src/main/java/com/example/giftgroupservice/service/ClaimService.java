package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.response.ClaimResponse;
import com.example.giftgroupservice.dto.response.ClaimResultResponse;

import java.util.List;
import java.util.Set;

/**
 * Service interface for claims (reservations of items, one claimer per item per group).
 */
public interface ClaimService {

    /**
     * Claim an item inside a group.
     *
     * Business rules:
     * - claimer must not own the item's list (Forbidden)
     * - claimer must be approved in the group, leader included (Forbidden)
     * - the item must be visible in the group, otherwise NotFound
     * - existing claim for (item, group) → Conflict, whoever holds it
     *
     * @param groupId Group ID
     * @param itemId Item ID
     * @param claimerId acting user
     * @return the created claim
     */
    ClaimResultResponse claim(Long groupId, Long itemId, Long claimerId);

    /**
     * Release the caller's claim. Missing claim, or one held by someone else, is a no-op.
     */
    ClaimResultResponse unclaim(Long groupId, Long itemId, Long claimerId);

    /**
     * Items claimed by anyone in the group.
     */
    Set<Long> claimedItemIds(Long groupId);

    /**
     * Items claimed by the viewer in the group.
     */
    Set<Long> myClaimedItemIds(Long groupId, Long viewerId);

    /**
     * Every claim of the viewer across all groups, newest first.
     */
    List<ClaimResponse> myClaims(Long viewerId);
}
