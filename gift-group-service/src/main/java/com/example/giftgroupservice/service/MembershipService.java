package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.response.MembershipResponse;

/**
 * Service interface for the group membership lifecycle.
 *
 * Every transition goes through MembershipState.apply, so illegal moves surface as
 * InvalidOperationException. Repeating an action whose target state already holds
 * reports ALREADY_* instead of failing.
 */
public interface MembershipService {

    /**
     * Ask to join a group, offering one of the caller's lists.
     *
     * Business rules:
     * - selected list must belong to the caller (InvalidSelection)
     * - a denied user may ask again (fresh pending request)
     * - a pending invite is turned into an approved membership
     *
     * @param groupId Group ID
     * @param userId acting user
     * @param selectedListId list to show in the group once approved
     */
    MembershipResponse requestToJoin(Long groupId, Long userId, Long selectedListId);

    /**
     * Same as {@link #requestToJoin}, with the group given by numeric id or by exact name
     * (case-insensitive). Lookup and join share one transaction.
     */
    MembershipResponse joinByIdentifier(String groupIdentifier, Long userId, Long selectedListId);

    /**
     * Leader invites a user by username or email.
     * A pending request from that user is approved right away.
     */
    MembershipResponse invite(Long groupId, Long leaderId, String identifier);

    /**
     * Leader approves a pending request. The member's selected list is linked into the group.
     */
    MembershipResponse approve(Long groupId, Long leaderId, Long userId);

    /**
     * Leader denies a pending request. The row stays in state DENIED.
     */
    MembershipResponse deny(Long groupId, Long leaderId, Long userId);

    /**
     * Invitee accepts, choosing one of their lists.
     */
    MembershipResponse accept(Long groupId, Long userId, Long selectedListId);

    /**
     * Invitee declines; no invite means nothing to remove.
     */
    MembershipResponse decline(Long groupId, Long userId);

    /**
     * A denied user removes their membership row; no row means nothing to remove.
     */
    MembershipResponse removeDenied(Long groupId, Long userId);

    /**
     * Member leaves (or withdraws a pending request). The leader cannot leave.
     * Runs the member-removal cascade.
     */
    MembershipResponse leave(Long groupId, Long userId);

    /**
     * Leader removes a member, invite or request. Runs the member-removal cascade.
     */
    MembershipResponse kick(Long groupId, Long leaderId, Long userId);
}
