package com.example.giftgroupservice.dto.response;

/**
 * Result of an idempotent action. Everything except APPLIED means nothing changed.
 */
public enum ActionOutcome {
    APPLIED,
    ALREADY_PENDING,
    ALREADY_INVITED,
    ALREADY_MEMBER,
    NOTHING_TO_REMOVE
}
