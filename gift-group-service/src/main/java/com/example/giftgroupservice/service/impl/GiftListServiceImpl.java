package com.example.giftgroupservice.service.impl;

import com.example.giftgroupservice.dto.request.AddItemRequest;
import com.example.giftgroupservice.dto.request.CreateListRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.GiftListResponse;
import com.example.giftgroupservice.dto.response.ItemResponse;
import com.example.giftgroupservice.entity.Claim;
import com.example.giftgroupservice.entity.GiftList;
import com.example.giftgroupservice.entity.Item;
import com.example.giftgroupservice.entity.ListGroup;
import com.example.giftgroupservice.exception.ForbiddenException;
import com.example.giftgroupservice.exception.ResourceNotFoundException;
import com.example.giftgroupservice.exception.UnauthorizedException;
import com.example.giftgroupservice.repository.ClaimRepository;
import com.example.giftgroupservice.repository.GiftListRepository;
import com.example.giftgroupservice.repository.GroupRepository;
import com.example.giftgroupservice.repository.ItemRepository;
import com.example.giftgroupservice.repository.ListGroupRepository;
import com.example.giftgroupservice.repository.MembershipRepository;
import com.example.giftgroupservice.repository.UserRepository;
import com.example.giftgroupservice.service.GiftListService;
import com.example.giftgroupservice.service.GroupLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Implementation of GiftListService.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class GiftListServiceImpl implements GiftListService {

    private final GiftListRepository giftListRepository;
    private final ItemRepository itemRepository;
    private final ListGroupRepository listGroupRepository;
    private final MembershipRepository membershipRepository;
    private final ClaimRepository claimRepository;
    private final GroupRepository groupRepository;
    private final UserRepository userRepository;
    private final GroupLifecycleService lifecycleService;

    @Override
    @Transactional
    public GiftListResponse createList(Long ownerId, CreateListRequest request) {
        log.info("Creating list: ownerId={}, name={}", ownerId, request.getName());

        if (!userRepository.existsById(ownerId)) {
            throw UnauthorizedException.profileNotRegistered(ownerId);
        }

        GiftList list = GiftList.builder()
                .ownerId(ownerId)
                .name(request.getName().trim())
                .build();
        GiftList saved = giftListRepository.save(list);

        log.info("List created: listId={}, ownerId={}", saved.getId(), ownerId);
        return GiftListResponse.from(saved);
    }

    @Override
    public List<GiftListResponse> getMyLists(Long ownerId) {
        return giftListRepository.findAllByOwnerIdOrderByCreatedAtAsc(ownerId).stream()
                .map(GiftListResponse::from)
                .toList();
    }

    @Override
    public GiftListResponse getList(Long listId, Long viewerId) {
        GiftList list = findList(listId);

        if (!list.isOwnedBy(viewerId)) {
            List<Long> groupIds = listGroupRepository.findAllByListId(listId).stream()
                    .map(ListGroup::getGroupId)
                    .toList();
            if (groupIds.isEmpty() || !membershipRepository.isApprovedInAny(groupIds, viewerId)) {
                throw ResourceNotFoundException.listNotFound(listId);
            }
        }

        return GiftListResponse.from(list, viewerId, itemsVisibleTo(list, viewerId, null));
    }

    @Override
    @Transactional
    public CascadeReport deleteList(Long listId, Long requesterId) {
        log.info("Deleting list: listId={}, requesterId={}", listId, requesterId);

        GiftList list = findList(listId);
        if (!list.isOwnedBy(requesterId)) {
            throw ForbiddenException.ownerOnly();
        }

        CascadeReport report = lifecycleService.deleteList(listId);
        log.info("List deleted: listId={}, rows={}", listId, report.totalRows());
        return report;
    }

    @Override
    @Transactional
    public ItemResponse addItem(Long listId, AddItemRequest request, Long requesterId) {
        log.info("Adding item: listId={}, requesterId={}", listId, requesterId);

        GiftList list = findList(listId);
        if (!list.isOwnedBy(requesterId)) {
            throw ForbiddenException.ownerOnly();
        }

        Item item = itemRepository.save(newItem(listId, request, requesterId));

        log.info("Item added: itemId={}, listId={}", item.getId(), listId);
        return ItemResponse.from(item);
    }

    @Override
    @Transactional
    public ItemResponse hideItem(Long listId, Long itemId, Long requesterId) {
        log.info("Hiding item: listId={}, itemId={}, requesterId={}", listId, itemId, requesterId);

        GiftList list = findList(listId);
        if (!list.isOwnedBy(requesterId)) {
            throw ForbiddenException.ownerOnly();
        }
        // surprise and already-hidden items answer like missing ids
        Item item = itemRepository.findById(itemId)
                .filter(i -> i.getListId().equals(listId))
                .filter(i -> i.isInOwnerView(requesterId))
                .orElseThrow(() -> ResourceNotFoundException.itemNotFound(itemId));

        item.hideFromOwner();

        log.info("Item hidden from owner: itemId={}", itemId);
        return ItemResponse.from(item);
    }

    @Override
    @Transactional
    public ItemResponse addSurpriseItem(Long groupId, Long listId, AddItemRequest request, Long addedById) {
        log.info("Adding surprise item: groupId={}, listId={}, addedById={}", groupId, listId, addedById);

        if (!groupRepository.existsById(groupId)) {
            throw ResourceNotFoundException.groupNotFound(groupId);
        }
        GiftList list = findList(listId);

        if (list.isOwnedBy(addedById)) {
            throw ForbiddenException.cannotSurpriseYourself();
        }
        if (!membershipRepository.isApprovedMember(groupId, addedById)) {
            throw ForbiddenException.notApprovedMember(groupId);
        }
        if (!listGroupRepository.existsByGroupIdAndListId(groupId, listId)) {
            throw ForbiddenException.listNotInGroup(listId, groupId);
        }

        Item item = newItem(listId, request, addedById);
        item.setHighPriority(false);
        item.setOwnerHidden(true);
        item.setScopeGroupId(groupId);
        Item saved = itemRepository.save(item);

        // Whoever adds the surprise is the one giving it
        claimRepository.save(Claim.builder()
                .itemId(saved.getId())
                .groupId(groupId)
                .claimerId(addedById)
                .build());

        log.info("Surprise item added and claimed: itemId={}, groupId={}", saved.getId(), groupId);
        return ItemResponse.from(saved);
    }

    @Override
    public List<ItemResponse> itemsVisibleTo(GiftList list, Long viewerId, Long groupId) {
        List<Item> items;
        if (list.isOwnedBy(viewerId)) {
            items = itemRepository.findOwnerView(list.getId(), viewerId);
        } else if (groupId != null) {
            items = itemRepository.findGroupView(list.getId(), groupId);
        } else {
            items = itemRepository.findUnscoped(list.getId());
        }
        return items.stream()
                .map(ItemResponse::from)
                .toList();
    }

    private GiftList findList(Long listId) {
        return giftListRepository.findById(listId)
                .orElseThrow(() -> ResourceNotFoundException.listNotFound(listId));
    }

    private static Item newItem(Long listId, AddItemRequest request, Long addedById) {
        return Item.builder()
                .listId(listId)
                .name(request.getName().trim())
                .url(request.getUrl())
                .notes(request.getNotes())
                .addedById(addedById)
                .highPriority(request.isHighPriority())
                .build();
    }
}
