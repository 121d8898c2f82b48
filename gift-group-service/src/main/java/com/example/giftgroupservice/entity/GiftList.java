package com.example.giftgroupservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A wish list owned by exactly one user (the recipient).
 */
@Entity
@Table(name = "gift_lists")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GiftList {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId.equals(userId);
    }
}
