package com.example.giftgroupservice.repository;

import com.example.giftgroupservice.entity.Item;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for Item entity.
 * Visibility rules live in the queries below; services never filter by hand.
 */
@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {

    /**
     * Owner's view: items the owner added and has not hidden. Surprise items are never
     * added by the owner, so they never appear here.
     */
    @Query("SELECT i FROM Item i WHERE i.listId = :listId " +
           "AND i.addedById = :ownerId AND i.ownerHidden = false " +
           "ORDER BY i.createdAt ASC")
    List<Item> findOwnerView(@Param("listId") Long listId, @Param("ownerId") Long ownerId);

    /**
     * Non-owner view inside a group: unscoped items plus items scoped to that group.
     */
    @Query("SELECT i FROM Item i WHERE i.listId = :listId " +
           "AND (i.scopeGroupId IS NULL OR i.scopeGroupId = :groupId) " +
           "ORDER BY i.createdAt ASC")
    List<Item> findGroupView(@Param("listId") Long listId, @Param("groupId") Long groupId);

    /**
     * Non-owner view without group context: unscoped items only.
     */
    @Query("SELECT i FROM Item i WHERE i.listId = :listId AND i.scopeGroupId IS NULL " +
           "ORDER BY i.createdAt ASC")
    List<Item> findUnscoped(@Param("listId") Long listId);

    List<Item> findAllByListIdIn(Collection<Long> listIds);

    /**
     * Owner-hidden surprise items scoped to a group on the given lists that are claimed
     * at least once in that group.
     */
    @Query("SELECT i FROM Item i WHERE i.listId IN :listIds " +
           "AND i.scopeGroupId = :groupId AND i.ownerHidden = true " +
           "AND EXISTS (SELECT c FROM Claim c WHERE c.itemId = i.id AND c.groupId = :groupId)")
    List<Item> findClaimedSurpriseItems(@Param("listIds") Collection<Long> listIds,
                                        @Param("groupId") Long groupId);
}
