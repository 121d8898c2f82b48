package com.example.giftgroupservice.exception;

import org.springframework.http.HttpStatus;

/**
 * The referenced list is not owned by the acting user (HTTP 400).
 */
public class InvalidSelectionException extends BaseException {

    public InvalidSelectionException(String message) {
        super("INVALID_LIST_SELECTION", message, HttpStatus.BAD_REQUEST);
    }

    public static InvalidSelectionException listNotOwned(Long listId) {
        return new InvalidSelectionException(
            String.format("List %s does not exist or is not yours", listId));
    }

    public static InvalidSelectionException listRequired() {
        return new InvalidSelectionException("A list of your own must be selected");
    }
}
