package com.example.giftgroupservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for resource not found errors (HTTP 404).
 * Also used when the caller may not see the resource, so existence is not leaked.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException userNotFound(String identifier) {
        return new ResourceNotFoundException(
            "USER_NOT_FOUND",
            String.format("User %s not found", identifier)
        );
    }

    public static ResourceNotFoundException groupNotFound(Long groupId) {
        return new ResourceNotFoundException(
            "GROUP_NOT_FOUND",
            String.format("Group with ID %s not found", groupId)
        );
    }

    public static ResourceNotFoundException groupNotFound(String identifier) {
        return new ResourceNotFoundException(
            "GROUP_NOT_FOUND",
            String.format("Group %s does not exist", identifier)
        );
    }

    public static ResourceNotFoundException listNotFound(Long listId) {
        return new ResourceNotFoundException(
            "LIST_NOT_FOUND",
            String.format("List with ID %s not found", listId)
        );
    }

    public static ResourceNotFoundException itemNotFound(Long itemId) {
        return new ResourceNotFoundException(
            "ITEM_NOT_FOUND",
            String.format("Item with ID %s not found", itemId)
        );
    }

    public static ResourceNotFoundException membershipNotFound(Long userId, Long groupId) {
        return new ResourceNotFoundException(
            "MEMBERSHIP_NOT_FOUND",
            String.format("User %s has no membership in group %s", userId, groupId)
        );
    }
}
