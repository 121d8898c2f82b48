package com.example.giftgroupservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * An entry on a gift list.
 *
 * Visibility fields:
 * - ownerHidden: once true, the list owner never sees the item again; everybody else still does.
 * - scopeGroupId: null means the item is part of the list wherever the list is shown.
 *   A value means the item is a surprise added by a third party and exists only inside that
 *   group. Logical reference (NO FK): the item outlives the group and is then visible nowhere.
 */
@Entity
@Table(name = "items")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "list_id", nullable = false, updatable = false)
    private Long listId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "url", length = 2000)
    private String url;

    @Column(name = "notes", length = 2000)
    private String notes;

    @Column(name = "added_by_id", nullable = false, updatable = false)
    private Long addedById;

    @Column(name = "high_priority", nullable = false)
    private boolean highPriority;

    @Column(name = "owner_hidden", nullable = false)
    private boolean ownerHidden;

    @Column(name = "scope_group_id", updatable = false)
    private Long scopeGroupId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public boolean isSurprise() {
        return scopeGroupId != null;
    }

    /**
     * Whether a non-owner looking at the list inside {@code groupId} may see this item.
     * With no group context only unscoped items qualify.
     */
    public boolean isVisibleInGroup(Long groupId) {
        return scopeGroupId == null || scopeGroupId.equals(groupId);
    }

    /**
     * Whether the list owner sees this item: added by the owner and not hidden since.
     */
    public boolean isInOwnerView(Long ownerId) {
        return ownerId.equals(addedById) && !ownerHidden;
    }

    /**
     * Soft delete from the owner's point of view.
     */
    public void hideFromOwner() {
        this.ownerHidden = true;
    }
}
