package com.example.giftgroupservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for forbidden access (HTTP 403).
 * User is authenticated but lacks permission.
 */
public class ForbiddenException extends BaseException {

    public ForbiddenException(String code, String message) {
        super(code, message, HttpStatus.FORBIDDEN);
    }

    public static ForbiddenException leaderOnly() {
        return new ForbiddenException("LEADER_ONLY", "Only the group leader can perform this action");
    }

    public static ForbiddenException notApprovedMember(Long groupId) {
        return new ForbiddenException("NOT_APPROVED_MEMBER",
            String.format("You are not an approved member of group %s", groupId));
    }

    public static ForbiddenException ownerOnly() {
        return new ForbiddenException("LIST_OWNER_ONLY", "Only the list owner can perform this action");
    }

    public static ForbiddenException cannotClaimOwnItem() {
        return new ForbiddenException("CANNOT_CLAIM_OWN_ITEM", "You cannot claim an item on your own list");
    }

    public static ForbiddenException cannotSurpriseYourself() {
        return new ForbiddenException("CANNOT_SURPRISE_SELF", "You cannot add a surprise item to your own list");
    }

    public static ForbiddenException listNotInGroup(Long listId, Long groupId) {
        return new ForbiddenException("LIST_NOT_IN_GROUP",
            String.format("List %s is not shared with group %s", listId, groupId));
    }
}
