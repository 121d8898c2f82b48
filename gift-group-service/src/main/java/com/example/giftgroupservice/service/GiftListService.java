package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.request.AddItemRequest;
import com.example.giftgroupservice.dto.request.CreateListRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.GiftListResponse;
import com.example.giftgroupservice.dto.response.ItemResponse;
import com.example.giftgroupservice.entity.GiftList;

import java.util.List;

/**
 * Service interface for gift lists and their items.
 */
public interface GiftListService {

    /**
     * Create a list owned by the caller. The caller must have a registered profile.
     */
    GiftListResponse createList(Long ownerId, CreateListRequest request);

    List<GiftListResponse> getMyLists(Long ownerId);

    /**
     * Single list with the items the viewer may see.
     * Non-owners need an approved membership in a group the list is shown in, else NotFound.
     */
    GiftListResponse getList(Long listId, Long viewerId);

    /**
     * Owner deletes a list with its items, their claims and its group links.
     */
    CascadeReport deleteList(Long listId, Long requesterId);

    /**
     * Owner adds a regular item (visible wherever the list is shown).
     */
    ItemResponse addItem(Long listId, AddItemRequest request, Long requesterId);

    /**
     * Owner hides an item from themselves. The row stays and others keep seeing it.
     * Items outside the owner's own view (surprise items, already hidden ones) are NotFound.
     */
    ItemResponse hideItem(Long listId, Long itemId, Long requesterId);

    /**
     * A group member adds a surprise item to someone else's list.
     *
     * Business rules:
     * - the list owner cannot add surprises to their own list
     * - the list must be shown in the group and the caller must be approved there
     * - the item is owner-hidden, scoped to the group, and claimed by the caller
     */
    ItemResponse addSurpriseItem(Long groupId, Long listId, AddItemRequest request, Long addedById);

    /**
     * Visibility filter for one list.
     * Owner: own items not hidden, never surprises.
     * Others: unscoped items plus items scoped to groupId (null means no group context).
     */
    List<ItemResponse> itemsVisibleTo(GiftList list, Long viewerId, Long groupId);
}
