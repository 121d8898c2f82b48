package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.request.CreateGroupRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.GroupManageResponse;
import com.example.giftgroupservice.dto.response.GroupResponse;
import com.example.giftgroupservice.dto.response.GroupViewResponse;
import com.example.giftgroupservice.dto.response.MyGroupResponse;

import java.util.List;

/**
 * Service interface for group management.
 */
public interface GroupService {

    /**
     * Create a new group led by the caller.
     *
     * Business rules:
     * - group name must be unique, ignoring case (Conflict)
     * - selected list must belong to the caller (InvalidSelection)
     * - the caller gets a LEADER membership and the list is shown in the group
     */
    GroupResponse createGroup(Long leaderId, CreateGroupRequest request);

    /**
     * Group page for an approved member (leader included); everybody else gets Forbidden.
     */
    GroupViewResponse getGroupView(Long groupId, Long viewerId);

    /**
     * Leader-only view of all membership rows, grouped by state.
     */
    GroupManageResponse getManageView(Long groupId, Long leaderId);

    /**
     * Search by numeric id or by case-insensitive name fragment.
     */
    List<GroupResponse> searchGroups(String query);

    /**
     * Resolve a group by numeric id or exact name (ignoring case).
     *
     * @throws com.example.giftgroupservice.exception.ResourceNotFoundException if nothing matches
     */
    GroupResponse findByIdentifier(String identifier);

    /**
     * Every group the user has a membership row in, with the user's state.
     */
    List<MyGroupResponse> getMyGroups(Long userId);

    /**
     * Leader deletes the group with all its memberships, links and claims.
     */
    CascadeReport deleteGroup(Long groupId, Long leaderId);
}
