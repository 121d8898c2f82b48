package com.example.giftgroupservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A user's promise to give an item, scoped to one group.
 *
 * Business rules:
 * - UNIQUE (item_id, group_id): one claimer per item per group; the same item may be
 *   claimed independently in every group it is visible in
 * - the claimer never owns the item's list (checked by ClaimService)
 */
@Entity
@Table(name = "claims",
        uniqueConstraints = @UniqueConstraint(name = "uq_claim_item_group", columnNames = {"item_id", "group_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Claim {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "item_id", nullable = false, updatable = false)
    private Long itemId;

    @Column(name = "group_id", nullable = false, updatable = false)
    private Long groupId;

    @Column(name = "claimer_id", nullable = false, updatable = false)
    private Long claimerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public boolean isHeldBy(Long userId) {
        return claimerId.equals(userId);
    }
}
