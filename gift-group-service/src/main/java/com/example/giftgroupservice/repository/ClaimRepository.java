package com.example.giftgroupservice.repository;

import com.example.giftgroupservice.entity.Claim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Claim entity.
 * UNIQUE (item_id, group_id) rejects the second of two concurrent claims.
 */
@Repository
public interface ClaimRepository extends JpaRepository<Claim, Long> {

    Optional<Claim> findByItemIdAndGroupId(Long itemId, Long groupId);

    List<Claim> findAllByGroupId(Long groupId);

    List<Claim> findAllByGroupIdAndClaimerId(Long groupId, Long claimerId);

    List<Claim> findAllByClaimerIdOrderByCreatedAtDesc(Long claimerId);

    List<Claim> findAllByItemIdIn(Collection<Long> itemIds);

    @Query("SELECT c.itemId FROM Claim c WHERE c.groupId = :groupId")
    List<Long> findItemIdsByGroupId(@Param("groupId") Long groupId);

    @Query("SELECT c.itemId FROM Claim c WHERE c.groupId = :groupId AND c.claimerId = :claimerId")
    List<Long> findItemIdsByGroupIdAndClaimerId(@Param("groupId") Long groupId,
                                                @Param("claimerId") Long claimerId);
}
