package com.example.giftgroupservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Locale;

/**
 * Gift group with a single leader (its creator).
 *
 * Names are unique case-insensitively: nameKey holds the lower-cased name and carries
 * the unique index.
 */
@Entity(name = "GiftGroup")
@Table(name = "gift_groups")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Group {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "name_key", nullable = false, unique = true, length = 100)
    private String nameKey;

    @Column(name = "leader_id", nullable = false, updatable = false)
    private Long leaderId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (nameKey == null && name != null) {
            nameKey = toNameKey(name);
        }
    }

    public boolean isLedBy(Long userId) {
        return leaderId.equals(userId);
    }

    public static String toNameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
