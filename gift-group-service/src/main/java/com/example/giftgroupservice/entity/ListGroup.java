package com.example.giftgroupservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Makes a gift list visible inside a group. One row per (group, list).
 */
@Entity
@Table(name = "list_groups",
        uniqueConstraints = @UniqueConstraint(name = "uq_list_in_group", columnNames = {"group_id", "list_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private Long groupId;

    @Column(name = "list_id", nullable = false, updatable = false)
    private Long listId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
