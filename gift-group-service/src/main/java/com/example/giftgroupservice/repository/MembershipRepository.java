package com.example.giftgroupservice.repository;

import com.example.giftgroupservice.entity.Membership;
import com.example.giftgroupservice.entity.MembershipState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Membership entity.
 * UNIQUE (group_id, user_id) is the arbiter for concurrent request/invite calls.
 */
@Repository
public interface MembershipRepository extends JpaRepository<Membership, Long> {

    Optional<Membership> findByGroupIdAndUserId(Long groupId, Long userId);

    List<Membership> findAllByGroupId(Long groupId);

    List<Membership> findAllByUserId(Long userId);

    List<Membership> findAllBySelectedListId(Long listId);

    /**
     * Members of a group in the given states, oldest first.
     */
    @Query("SELECT m FROM Membership m WHERE m.groupId = :groupId AND m.state IN :states " +
           "ORDER BY m.createdAt ASC")
    List<Membership> findAllByGroupIdAndStateIn(@Param("groupId") Long groupId,
                                                @Param("states") Collection<MembershipState> states);

    /**
     * Check whether the user may view and claim in the group (leader or approved).
     */
    @Query("SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END " +
           "FROM Membership m WHERE m.groupId = :groupId AND m.userId = :userId " +
           "AND m.state IN (com.example.giftgroupservice.entity.MembershipState.LEADER, " +
           "com.example.giftgroupservice.entity.MembershipState.APPROVED)")
    boolean isApprovedMember(@Param("groupId") Long groupId, @Param("userId") Long userId);

    /**
     * Whether the user is approved in at least one of the given groups.
     */
    @Query("SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END " +
           "FROM Membership m WHERE m.groupId IN :groupIds AND m.userId = :userId " +
           "AND m.state IN (com.example.giftgroupservice.entity.MembershipState.LEADER, " +
           "com.example.giftgroupservice.entity.MembershipState.APPROVED)")
    boolean isApprovedInAny(@Param("groupIds") Collection<Long> groupIds, @Param("userId") Long userId);
}
