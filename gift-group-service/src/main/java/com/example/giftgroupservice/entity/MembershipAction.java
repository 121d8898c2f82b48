package com.example.giftgroupservice.entity;

/**
 * Actions that move a membership between states.
 * DECLINE, REMOVE, LEAVE and KICK delete the row when accepted.
 */
public enum MembershipAction {
    REQUEST,
    INVITE,
    APPROVE,
    DENY,
    ACCEPT,
    DECLINE,
    REMOVE,
    LEAVE,
    KICK
}
