package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.response.CascadeReport;

/**
 * Cascading cleanup of memberships, groups, lists and accounts.
 *
 * Every method runs inside the caller's transaction (or opens one) so a failure
 * anywhere leaves no partial deletion behind. No authorization checks here:
 * callers decide who may trigger a cascade.
 */
public interface GroupLifecycleService {

    /**
     * Member-removal cascade for one user in one group.
     *
     * Deletes:
     * - the membership row
     * - links between the user's lists and the group
     * - owner-hidden surprise items scoped to the group on the user's lists that are
     *   claimed in the group, together with their claims
     * - claims the user made inside the group
     *
     * @param groupId Group ID
     * @param userId User ID
     * @return deleted rows
     */
    CascadeReport removeMember(Long groupId, Long userId);

    /**
     * Group-deletion cascade: all memberships, links and claims of the group, then the
     * group itself. Items are kept.
     */
    CascadeReport deleteGroup(Long groupId);

    /**
     * Delete one list with its items, the claims on those items and its links.
     * Memberships that selected the list keep their row with no selected list.
     */
    CascadeReport deleteList(Long listId);

    /**
     * Account-deletion cascade:
     * 1. group-deletion for every group the user leads
     * 2. member-removal for every other membership
     * 3. list deletion for every list the user owns
     * 4. remaining claims made by the user
     * 5. the user row
     *
     * Running it for an unknown user returns an empty report.
     */
    CascadeReport deleteAccount(Long userId);
}
