package com.example.giftgroupservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for unauthorized access (HTTP 401).
 */
public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String code, String message) {
        super(code, message, HttpStatus.UNAUTHORIZED);
    }

    /**
     * Token is valid but the identity has not registered a profile yet.
     */
    public static UnauthorizedException profileNotRegistered(Long userId) {
        return new UnauthorizedException("PROFILE_NOT_REGISTERED",
            String.format("User %s has no profile; register one first", userId));
    }
}
