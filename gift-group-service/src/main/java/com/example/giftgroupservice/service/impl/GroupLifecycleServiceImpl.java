package com.example.giftgroupservice.service.impl;

import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.entity.Claim;
import com.example.giftgroupservice.entity.GiftList;
import com.example.giftgroupservice.entity.Group;
import com.example.giftgroupservice.entity.Item;
import com.example.giftgroupservice.entity.ListGroup;
import com.example.giftgroupservice.entity.Membership;
import com.example.giftgroupservice.repository.ClaimRepository;
import com.example.giftgroupservice.repository.GiftListRepository;
import com.example.giftgroupservice.repository.GroupRepository;
import com.example.giftgroupservice.repository.ItemRepository;
import com.example.giftgroupservice.repository.ListGroupRepository;
import com.example.giftgroupservice.repository.MembershipRepository;
import com.example.giftgroupservice.repository.UserRepository;
import com.example.giftgroupservice.service.GroupLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Implementation of GroupLifecycleService.
 *
 * Rows are removed child-first (claims, items, links, memberships, then the parent)
 * so the foreign keys in the schema never see an orphan, even mid-flush.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class GroupLifecycleServiceImpl implements GroupLifecycleService {

    private final MembershipRepository membershipRepository;
    private final ListGroupRepository listGroupRepository;
    private final ClaimRepository claimRepository;
    private final ItemRepository itemRepository;
    private final GiftListRepository giftListRepository;
    private final GroupRepository groupRepository;
    private final UserRepository userRepository;

    @Override
    public CascadeReport removeMember(Long groupId, Long userId) {
        log.info("Member-removal cascade: groupId={}, userId={}", groupId, userId);
        CascadeReport report = CascadeReport.empty();

        membershipRepository.findByGroupIdAndUserId(groupId, userId).ifPresent(membership -> {
            membershipRepository.delete(membership);
            report.getMemberships().add(membership.getId());
        });

        List<Long> ownedListIds = giftListRepository.findAllByOwnerIdOrderByCreatedAtAsc(userId).stream()
                .map(GiftList::getId)
                .toList();

        if (!ownedListIds.isEmpty()) {
            List<ListGroup> links = listGroupRepository.findAllByGroupIdAndListIdIn(groupId, ownedListIds);
            listGroupRepository.deleteAll(links);
            links.forEach(link -> report.getListGroups().add(link.getId()));

            List<Item> surpriseItems = itemRepository.findClaimedSurpriseItems(ownedListIds, groupId);
            if (!surpriseItems.isEmpty()) {
                deleteItemsWithClaims(surpriseItems, report);
            }
        }

        // Reservations the user made on other people's items in this group
        List<Claim> ownClaims = claimRepository.findAllByGroupIdAndClaimerId(groupId, userId);
        claimRepository.deleteAll(ownClaims);
        ownClaims.forEach(claim -> report.getClaims().add(claim.getId()));

        log.info("Member-removal cascade done: groupId={}, userId={}, rows={}",
                groupId, userId, report.totalRows());
        return report;
    }

    @Override
    public CascadeReport deleteGroup(Long groupId) {
        log.info("Group-deletion cascade: groupId={}", groupId);
        CascadeReport report = CascadeReport.empty();

        List<Claim> claims = claimRepository.findAllByGroupId(groupId);
        claimRepository.deleteAll(claims);
        claims.forEach(claim -> report.getClaims().add(claim.getId()));

        List<ListGroup> links = listGroupRepository.findAllByGroupId(groupId);
        listGroupRepository.deleteAll(links);
        links.forEach(link -> report.getListGroups().add(link.getId()));

        List<Membership> memberships = membershipRepository.findAllByGroupId(groupId);
        membershipRepository.deleteAll(memberships);
        memberships.forEach(membership -> report.getMemberships().add(membership.getId()));

        groupRepository.findById(groupId).ifPresent(group -> {
            groupRepository.delete(group);
            report.getGroups().add(group.getId());
        });

        log.info("Group-deletion cascade done: groupId={}, rows={}", groupId, report.totalRows());
        return report;
    }

    @Override
    public CascadeReport deleteList(Long listId) {
        log.info("List deletion: listId={}", listId);
        CascadeReport report = CascadeReport.empty();

        List<Item> items = itemRepository.findAllByListIdIn(List.of(listId));
        if (!items.isEmpty()) {
            deleteItemsWithClaims(items, report);
        }

        List<ListGroup> links = listGroupRepository.findAllByListId(listId);
        listGroupRepository.deleteAll(links);
        links.forEach(link -> report.getListGroups().add(link.getId()));

        membershipRepository.findAllBySelectedListId(listId)
                .forEach(membership -> membership.setSelectedListId(null));

        giftListRepository.findById(listId).ifPresent(list -> {
            giftListRepository.delete(list);
            report.getLists().add(list.getId());
        });

        return report;
    }

    @Override
    public CascadeReport deleteAccount(Long userId) {
        log.info("Account-deletion cascade: userId={}", userId);
        CascadeReport report = CascadeReport.empty();

        for (Group group : groupRepository.findAllByLeaderId(userId)) {
            report.merge(deleteGroup(group.getId()));
        }

        for (Membership membership : membershipRepository.findAllByUserId(userId)) {
            report.merge(removeMember(membership.getGroupId(), userId));
        }

        for (GiftList list : giftListRepository.findAllByOwnerIdOrderByCreatedAtAsc(userId)) {
            report.merge(deleteList(list.getId()));
        }

        List<Claim> strayClaims = claimRepository.findAllByClaimerIdOrderByCreatedAtDesc(userId);
        claimRepository.deleteAll(strayClaims);
        strayClaims.forEach(claim -> report.getClaims().add(claim.getId()));

        userRepository.findById(userId).ifPresent(user -> {
            userRepository.delete(user);
            report.getUsers().add(user.getId());
        });

        log.info("Account-deletion cascade done: userId={}, rows={}", userId, report.totalRows());
        return report;
    }

    private void deleteItemsWithClaims(List<Item> items, CascadeReport report) {
        List<Long> itemIds = items.stream().map(Item::getId).toList();
        List<Claim> claims = claimRepository.findAllByItemIdIn(itemIds);
        claimRepository.deleteAll(claims);
        claims.forEach(claim -> report.getClaims().add(claim.getId()));

        itemRepository.deleteAll(items);
        report.getItems().addAll(itemIds);
    }
}
