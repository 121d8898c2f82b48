package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * User Deleted Event
 *
 * Published by: the identity service when an account is closed.
 * Consumed by: gift-group-service, which runs the account-deletion cascade
 * (led groups, memberships, lists, items, claims, profile).
 *
 * Consumers must treat redelivery as a no-op.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDeletedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Identity of the closed account
     */
    private Long userId;

    /**
     * Contact address at deletion time (for logging)
     */
    private String email;

    /**
     * When the account was closed
     */
    private Instant deletedAt;

    /**
     * Event ID (UUID) used to deduplicate
     */
    private String eventId;

    private Instant eventTimestamp;
}
