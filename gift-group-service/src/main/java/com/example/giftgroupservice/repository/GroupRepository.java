package com.example.giftgroupservice.repository;

import com.example.giftgroupservice.entity.Group;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Group entity.
 * Name comparisons always go through nameKey (lower-cased name).
 */
@Repository
public interface GroupRepository extends JpaRepository<Group, Long> {

    boolean existsByNameKey(String nameKey);

    Optional<Group> findByNameKey(String nameKey);

    /**
     * Case-insensitive substring search on the group name.
     */
    @Query("SELECT g FROM GiftGroup g WHERE g.nameKey LIKE CONCAT('%', :fragment, '%') ORDER BY g.name ASC")
    List<Group> searchByNameKey(@Param("fragment") String fragment);

    List<Group> findAllByLeaderId(Long leaderId);
}
