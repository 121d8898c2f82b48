package com.example.giftgroupservice.repository;

import com.example.giftgroupservice.entity.ListGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for ListGroup links.
 */
@Repository
public interface ListGroupRepository extends JpaRepository<ListGroup, Long> {

    boolean existsByGroupIdAndListId(Long groupId, Long listId);

    List<ListGroup> findAllByGroupId(Long groupId);

    List<ListGroup> findAllByListId(Long listId);

    List<ListGroup> findAllByGroupIdAndListIdIn(Long groupId, Collection<Long> listIds);

    List<ListGroup> findAllByListIdIn(Collection<Long> listIds);
}
