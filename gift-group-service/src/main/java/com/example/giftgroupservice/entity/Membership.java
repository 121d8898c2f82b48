package com.example.giftgroupservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Optional;

/**
 * Membership of one user in one group.
 *
 * Business rules:
 * - UNIQUE (group_id, user_id): at most one row per pair, so concurrent
 *   request/invite calls cannot create duplicates
 * - state changes only through {@link #transition(MembershipAction)}
 * - selectedListId: the member's own list shown to the group once approved
 */
@Entity
@Table(name = "memberships",
        uniqueConstraints = @UniqueConstraint(name = "uq_membership_group_user", columnNames = {"group_id", "user_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Membership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private Long groupId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private MembershipState state;

    @Column(name = "selected_list_id")
    private Long selectedListId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Integer version;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Move this membership according to the state machine.
     *
     * @return true if the row must be deleted
     */
    public boolean transition(MembershipAction action) {
        Optional<MembershipState> next = state.apply(action);
        next.ifPresent(s -> this.state = s);
        return next.isEmpty();
    }

    public boolean isApproved() {
        return state.isApproved();
    }
}
