package com.example.giftgroupservice.repository;

import com.example.giftgroupservice.entity.GiftList;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for GiftList entity.
 */
@Repository
public interface GiftListRepository extends JpaRepository<GiftList, Long> {

    List<GiftList> findAllByOwnerIdOrderByCreatedAtAsc(Long ownerId);

    /**
     * Lists shown in a group, in link order.
     */
    @Query("SELECT gl FROM GiftList gl JOIN ListGroup lg ON lg.listId = gl.id " +
           "WHERE lg.groupId = :groupId ORDER BY lg.createdAt ASC")
    List<GiftList> findAllVisibleInGroup(@Param("groupId") Long groupId);

    List<GiftList> findAllByIdIn(Collection<Long> ids);
}
