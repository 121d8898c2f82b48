package com.example.giftgroupservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for conflict errors (HTTP 409).
 * Used for uniqueness violations.
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    public static ConflictException itemAlreadyClaimed(Long itemId, Long groupId) {
        return new ConflictException(
            "ITEM_ALREADY_CLAIMED",
            String.format("Item %s is already claimed by someone else in group %s", itemId, groupId)
        );
    }

    /**
     * The caller already holds the claim. Nothing changed.
     */
    public static ConflictException itemAlreadyClaimedByYou(Long itemId, Long groupId) {
        return new ConflictException(
            "ITEM_ALREADY_CLAIMED_BY_YOU",
            String.format("You already claimed item %s in group %s", itemId, groupId)
        );
    }

    public static ConflictException groupNameDuplicate(String groupName) {
        return new ConflictException(
            "GROUP_NAME_DUPLICATE",
            String.format("Group name %s already exists", groupName)
        );
    }

    public static ConflictException concurrentMembershipChange(Long userId, Long groupId) {
        return new ConflictException(
            "MEMBERSHIP_CONFLICT",
            String.format("Membership of user %s in group %s was changed concurrently", userId, groupId)
        );
    }

    public static ConflictException usernameTaken(String username) {
        return new ConflictException(
            "USERNAME_TAKEN",
            String.format("Username %s is already taken", username)
        );
    }

    public static ConflictException emailTaken(String email) {
        return new ConflictException(
            "EMAIL_TAKEN",
            String.format("Email %s is already registered", email)
        );
    }

    public static ConflictException profileAlreadyExists(Long userId) {
        return new ConflictException(
            "PROFILE_ALREADY_EXISTS",
            String.format("User %s already has a profile", userId)
        );
    }
}
