package com.example.giftgroupservice.service.impl;

import com.example.giftgroupservice.dto.response.ActionOutcome;
import com.example.giftgroupservice.dto.response.ClaimResponse;
import com.example.giftgroupservice.dto.response.ClaimResultResponse;
import com.example.giftgroupservice.entity.Claim;
import com.example.giftgroupservice.entity.GiftList;
import com.example.giftgroupservice.entity.Group;
import com.example.giftgroupservice.entity.Item;
import com.example.giftgroupservice.exception.ConflictException;
import com.example.giftgroupservice.exception.ForbiddenException;
import com.example.giftgroupservice.exception.ResourceNotFoundException;
import com.example.giftgroupservice.repository.ClaimRepository;
import com.example.giftgroupservice.repository.GiftListRepository;
import com.example.giftgroupservice.repository.GroupRepository;
import com.example.giftgroupservice.repository.ItemRepository;
import com.example.giftgroupservice.repository.ListGroupRepository;
import com.example.giftgroupservice.repository.MembershipRepository;
import com.example.giftgroupservice.service.ClaimService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of ClaimService.
 *
 * The unique key (item_id, group_id) decides concurrent claims: the losing insert fails
 * on flush and is reported as ITEM_ALREADY_CLAIMED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ClaimServiceImpl implements ClaimService {

    private final ClaimRepository claimRepository;
    private final ItemRepository itemRepository;
    private final GiftListRepository giftListRepository;
    private final GroupRepository groupRepository;
    private final ListGroupRepository listGroupRepository;
    private final MembershipRepository membershipRepository;

    @Override
    @Transactional
    public ClaimResultResponse claim(Long groupId, Long itemId, Long claimerId) {
        log.info("Claim: groupId={}, itemId={}, claimerId={}", groupId, itemId, claimerId);

        if (!groupRepository.existsById(groupId)) {
            throw ResourceNotFoundException.groupNotFound(groupId);
        }
        Item item = itemRepository.findById(itemId)
                .orElseThrow(() -> ResourceNotFoundException.itemNotFound(itemId));
        GiftList list = giftListRepository.findById(item.getListId())
                .orElseThrow(() -> ResourceNotFoundException.listNotFound(item.getListId()));

        if (list.isOwnedBy(claimerId)) {
            throw ForbiddenException.cannotClaimOwnItem();
        }
        if (!membershipRepository.isApprovedMember(groupId, claimerId)) {
            throw ForbiddenException.notApprovedMember(groupId);
        }
        if (!item.isVisibleInGroup(groupId) || !listGroupRepository.existsByGroupIdAndListId(groupId, list.getId())) {
            throw ResourceNotFoundException.itemNotFound(itemId);
        }

        Optional<Claim> existing = claimRepository.findByItemIdAndGroupId(itemId, groupId);
        if (existing.isPresent()) {
            if (existing.get().isHeldBy(claimerId)) {
                throw ConflictException.itemAlreadyClaimedByYou(itemId, groupId);
            }
            throw ConflictException.itemAlreadyClaimed(itemId, groupId);
        }

        Claim claim = Claim.builder()
                .itemId(itemId)
                .groupId(groupId)
                .claimerId(claimerId)
                .build();
        try {
            claimRepository.saveAndFlush(claim);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.warn("Concurrent claim lost: groupId={}, itemId={}, claimerId={}", groupId, itemId, claimerId);
            throw ConflictException.itemAlreadyClaimed(itemId, groupId);
        }

        log.info("Item claimed: claimId={}, groupId={}, itemId={}", claim.getId(), groupId, itemId);
        return result(itemId, groupId, claimerId, ActionOutcome.APPLIED);
    }

    @Override
    @Transactional
    public ClaimResultResponse unclaim(Long groupId, Long itemId, Long claimerId) {
        log.info("Unclaim: groupId={}, itemId={}, claimerId={}", groupId, itemId, claimerId);

        Optional<Claim> claim = claimRepository.findByItemIdAndGroupId(itemId, groupId)
                .filter(c -> c.isHeldBy(claimerId));
        if (claim.isEmpty()) {
            return result(itemId, groupId, claimerId, ActionOutcome.NOTHING_TO_REMOVE);
        }

        claimRepository.delete(claim.get());
        log.info("Item unclaimed: groupId={}, itemId={}", groupId, itemId);
        return result(itemId, groupId, claimerId, ActionOutcome.APPLIED);
    }

    @Override
    public Set<Long> claimedItemIds(Long groupId) {
        return new HashSet<>(claimRepository.findItemIdsByGroupId(groupId));
    }

    @Override
    public Set<Long> myClaimedItemIds(Long groupId, Long viewerId) {
        return new HashSet<>(claimRepository.findItemIdsByGroupIdAndClaimerId(groupId, viewerId));
    }

    @Override
    public List<ClaimResponse> myClaims(Long viewerId) {
        List<Claim> claims = claimRepository.findAllByClaimerIdOrderByCreatedAtDesc(viewerId);
        if (claims.isEmpty()) {
            return List.of();
        }

        Map<Long, Item> items = itemRepository.findAllById(
                        claims.stream().map(Claim::getItemId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(Item::getId, Function.identity()));
        Map<Long, GiftList> lists = giftListRepository.findAllByIdIn(
                        items.values().stream().map(Item::getListId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(GiftList::getId, Function.identity()));
        Map<Long, Group> groups = groupRepository.findAllById(
                        claims.stream().map(Claim::getGroupId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(Group::getId, Function.identity()));

        return claims.stream()
                .filter(claim -> items.containsKey(claim.getItemId()))
                .map(claim -> {
                    Item item = items.get(claim.getItemId());
                    GiftList list = lists.get(item.getListId());
                    Group group = groups.get(claim.getGroupId());
                    return ClaimResponse.builder()
                            .claimId(claim.getId())
                            .itemId(item.getId())
                            .itemName(item.getName())
                            .listId(item.getListId())
                            .listName(list != null ? list.getName() : null)
                            .recipientId(list != null ? list.getOwnerId() : null)
                            .groupId(claim.getGroupId())
                            .groupName(group != null ? group.getName() : null)
                            .claimedAt(claim.getCreatedAt())
                            .build();
                })
                .toList();
    }

    private static ClaimResultResponse result(Long itemId, Long groupId, Long claimerId, ActionOutcome outcome) {
        return ClaimResultResponse.builder()
                .itemId(itemId)
                .groupId(groupId)
                .claimerId(claimerId)
                .outcome(outcome)
                .build();
    }
}
