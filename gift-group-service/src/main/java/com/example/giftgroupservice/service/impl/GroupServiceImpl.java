package com.example.giftgroupservice.service.impl;

import com.example.giftgroupservice.dto.request.CreateGroupRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.GiftListResponse;
import com.example.giftgroupservice.dto.response.GroupManageResponse;
import com.example.giftgroupservice.dto.response.GroupResponse;
import com.example.giftgroupservice.dto.response.GroupViewResponse;
import com.example.giftgroupservice.dto.response.ItemResponse;
import com.example.giftgroupservice.dto.response.MemberResponse;
import com.example.giftgroupservice.dto.response.MyGroupResponse;
import com.example.giftgroupservice.entity.GiftList;
import com.example.giftgroupservice.entity.Group;
import com.example.giftgroupservice.entity.ListGroup;
import com.example.giftgroupservice.entity.Membership;
import com.example.giftgroupservice.entity.MembershipState;
import com.example.giftgroupservice.entity.User;
import com.example.giftgroupservice.exception.ConflictException;
import com.example.giftgroupservice.exception.ForbiddenException;
import com.example.giftgroupservice.exception.InvalidSelectionException;
import com.example.giftgroupservice.exception.ResourceNotFoundException;
import com.example.giftgroupservice.repository.GiftListRepository;
import com.example.giftgroupservice.repository.GroupRepository;
import com.example.giftgroupservice.repository.ListGroupRepository;
import com.example.giftgroupservice.repository.MembershipRepository;
import com.example.giftgroupservice.repository.UserRepository;
import com.example.giftgroupservice.service.ClaimService;
import com.example.giftgroupservice.service.GiftListService;
import com.example.giftgroupservice.service.GroupLifecycleService;
import com.example.giftgroupservice.service.GroupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of GroupService.
 * Business Rules:
 * - the creator is the only leader and never changes
 * - name uniqueness is enforced on nameKey (lower-cased name)
 * - group pages are filtered per viewer: own list without surprises, other lists with
 *   this group's surprises
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class GroupServiceImpl implements GroupService {

    private final GroupRepository groupRepository;
    private final MembershipRepository membershipRepository;
    private final GiftListRepository giftListRepository;
    private final ListGroupRepository listGroupRepository;
    private final UserRepository userRepository;
    private final GiftListService giftListService;
    private final ClaimService claimService;
    private final GroupLifecycleService lifecycleService;

    @Override
    @Transactional
    public GroupResponse createGroup(Long leaderId, CreateGroupRequest request) {
        String name = request.getName().trim();
        log.info("Creating group: name={}, leaderId={}", name, leaderId);

        if (groupRepository.existsByNameKey(Group.toNameKey(name))) {
            throw ConflictException.groupNameDuplicate(name);
        }
        GiftList list = giftListRepository.findById(request.getSelectedListId())
                .filter(l -> l.isOwnedBy(leaderId))
                .orElseThrow(() -> InvalidSelectionException.listNotOwned(request.getSelectedListId()));

        Group group = Group.builder()
                .name(name)
                .nameKey(Group.toNameKey(name))
                .leaderId(leaderId)
                .build();
        try {
            group = groupRepository.saveAndFlush(group);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent group creation with name {}", name);
            throw ConflictException.groupNameDuplicate(name);
        }

        membershipRepository.save(Membership.builder()
                .groupId(group.getId())
                .userId(leaderId)
                .state(MembershipState.LEADER)
                .selectedListId(list.getId())
                .build());
        listGroupRepository.save(ListGroup.builder()
                .groupId(group.getId())
                .listId(list.getId())
                .build());

        log.info("Group created: groupId={}, leaderId={}", group.getId(), leaderId);
        return GroupResponse.from(group);
    }

    @Override
    public GroupViewResponse getGroupView(Long groupId, Long viewerId) {
        Group group = findGroup(groupId);
        if (!membershipRepository.isApprovedMember(groupId, viewerId)) {
            throw ForbiddenException.notApprovedMember(groupId);
        }

        List<GiftList> lists = giftListRepository.findAllVisibleInGroup(groupId);
        Map<Long, List<ItemResponse>> itemsByList = new LinkedHashMap<>();
        for (GiftList list : lists) {
            itemsByList.put(list.getId(), giftListService.itemsVisibleTo(list, viewerId, groupId));
        }

        // claim ids never mention items the viewer cannot see (surprises on their own list)
        Set<Long> visibleItemIds = itemsByList.values().stream()
                .flatMap(List::stream)
                .map(ItemResponse::getId)
                .collect(Collectors.toSet());
        Set<Long> claimed = new HashSet<>(claimService.claimedItemIds(groupId));
        claimed.retainAll(visibleItemIds);
        Set<Long> myClaimed = new HashSet<>(claimService.myClaimedItemIds(groupId, viewerId));
        myClaimed.retainAll(visibleItemIds);

        List<Membership> approved = membershipRepository.findAllByGroupIdAndStateIn(
                groupId, EnumSet.of(MembershipState.LEADER, MembershipState.APPROVED));

        return GroupViewResponse.builder()
                .group(GroupResponse.from(group))
                .visibleLists(lists.stream().map(GiftListResponse::from).toList())
                .itemsByList(itemsByList)
                .members(toMembers(approved))
                .claimedItemIds(claimed)
                .myClaimedItemIds(myClaimed)
                .build();
    }

    @Override
    public GroupManageResponse getManageView(Long groupId, Long leaderId) {
        Group group = findGroup(groupId);
        if (!group.isLedBy(leaderId)) {
            throw ForbiddenException.leaderOnly();
        }

        List<MemberResponse> members = toMembers(membershipRepository.findAllByGroupId(groupId));
        Map<MembershipState, List<MemberResponse>> byState = members.stream()
                .collect(Collectors.groupingBy(MemberResponse::getState));

        return GroupManageResponse.builder()
                .group(GroupResponse.from(group))
                .pendingRequests(byState.getOrDefault(MembershipState.PENDING_REQUEST, List.of()))
                .pendingInvites(byState.getOrDefault(MembershipState.PENDING_INVITE, List.of()))
                .denied(byState.getOrDefault(MembershipState.DENIED, List.of()))
                .approved(members.stream().filter(m -> m.getState().isApproved()).toList())
                .build();
    }

    @Override
    public List<GroupResponse> searchGroups(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }

        Long id = parseId(trimmed);
        if (id != null) {
            return groupRepository.findById(id)
                    .map(group -> List.of(GroupResponse.from(group)))
                    .orElse(List.of());
        }

        return groupRepository.searchByNameKey(Group.toNameKey(trimmed)).stream()
                .map(GroupResponse::from)
                .toList();
    }

    @Override
    public GroupResponse findByIdentifier(String identifier) {
        String trimmed = identifier.trim();
        Long id = parseId(trimmed);
        if (id != null) {
            return GroupResponse.from(findGroup(id));
        }
        return groupRepository.findByNameKey(Group.toNameKey(trimmed))
                .map(GroupResponse::from)
                .orElseThrow(() -> ResourceNotFoundException.groupNotFound(trimmed));
    }

    @Override
    public List<MyGroupResponse> getMyGroups(Long userId) {
        List<Membership> memberships = membershipRepository.findAllByUserId(userId);
        Map<Long, Group> groups = groupRepository.findAllById(
                        memberships.stream().map(Membership::getGroupId).toList()).stream()
                .collect(Collectors.toMap(Group::getId, Function.identity()));

        return memberships.stream()
                .filter(m -> groups.containsKey(m.getGroupId()))
                .map(m -> MyGroupResponse.builder()
                        .group(GroupResponse.from(groups.get(m.getGroupId())))
                        .state(m.getState())
                        .selectedListId(m.getSelectedListId())
                        .build())
                .sorted(Comparator.comparing(g -> g.getGroup().getName(), String.CASE_INSENSITIVE_ORDER))
                .toList();
    }

    @Override
    @Transactional
    public CascadeReport deleteGroup(Long groupId, Long leaderId) {
        log.info("Deleting group: groupId={}, requesterId={}", groupId, leaderId);

        Group group = findGroup(groupId);
        if (!group.isLedBy(leaderId)) {
            throw ForbiddenException.leaderOnly();
        }

        CascadeReport report = lifecycleService.deleteGroup(groupId);
        log.info("Group deleted: groupId={}, rows={}", groupId, report.totalRows());
        return report;
    }

    private Group findGroup(Long groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> ResourceNotFoundException.groupNotFound(groupId));
    }

    private List<MemberResponse> toMembers(Collection<Membership> memberships) {
        if (memberships.isEmpty()) {
            return List.of();
        }
        Map<Long, User> users = userRepository.findAllById(
                        memberships.stream().map(Membership::getUserId).toList()).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
        Map<Long, String> listNames = giftListRepository.findAllByIdIn(
                        memberships.stream()
                                .map(Membership::getSelectedListId)
                                .filter(Objects::nonNull)
                                .collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(GiftList::getId, GiftList::getName));

        return memberships.stream()
                .map(m -> MemberResponse.from(m, users.get(m.getUserId()),
                        m.getSelectedListId() != null ? listNames.get(m.getSelectedListId()) : null))
                .toList();
    }

    private static Long parseId(String value) {
        if (!value.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            // too many digits for an id; treat as a name
            return null;
        }
    }
}
