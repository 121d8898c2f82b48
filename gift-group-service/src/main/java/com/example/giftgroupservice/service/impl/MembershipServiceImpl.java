package com.example.giftgroupservice.service.impl;

import com.example.giftgroupservice.dto.response.ActionOutcome;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.GroupResponse;
import com.example.giftgroupservice.dto.response.MembershipResponse;
import com.example.giftgroupservice.entity.GiftList;
import com.example.giftgroupservice.entity.Group;
import com.example.giftgroupservice.entity.ListGroup;
import com.example.giftgroupservice.entity.Membership;
import com.example.giftgroupservice.entity.MembershipAction;
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
import com.example.giftgroupservice.service.GroupLifecycleService;
import com.example.giftgroupservice.service.GroupService;
import com.example.giftgroupservice.service.MembershipService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Implementation of MembershipService.
 * Business Rules:
 * - UNIQUE (group_id, user_id) arbitrates concurrent request/invite for the same pair
 * - @Version on Membership rejects concurrent transitions of the same row
 * - reaching APPROVED links the member's selected list into the group
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class MembershipServiceImpl implements MembershipService {

    private final MembershipRepository membershipRepository;
    private final GroupRepository groupRepository;
    private final GiftListRepository giftListRepository;
    private final ListGroupRepository listGroupRepository;
    private final UserRepository userRepository;
    private final GroupLifecycleService lifecycleService;
    private final GroupService groupService;

    @Override
    @Transactional
    public MembershipResponse requestToJoin(Long groupId, Long userId, Long selectedListId) {
        log.info("Join request: groupId={}, userId={}, listId={}", groupId, userId, selectedListId);

        requireGroup(groupId);
        GiftList list = requireOwnedList(selectedListId, userId);

        Optional<Membership> existing = membershipRepository.findByGroupIdAndUserId(groupId, userId);
        if (existing.isEmpty()) {
            Membership created = createMembership(groupId, userId, MembershipAction.REQUEST, list.getId());
            log.info("Join request created: groupId={}, userId={}", groupId, userId);
            return toResponse(created, ActionOutcome.APPLIED);
        }

        Membership membership = existing.get();

        MembershipState previous = membership.getState();
        membership.transition(MembershipAction.REQUEST);
        ActionOutcome outcome = outcomeOf(previous, membership.getState());
        if (outcome == ActionOutcome.APPLIED) {
            membership.setSelectedListId(list.getId());
            linkIfApproved(membership, previous);
        }

        log.info("Join request: groupId={}, userId={}, {} -> {}", groupId, userId, previous, membership.getState());
        return toResponse(membership, outcome);
    }

    @Override
    @Transactional
    public MembershipResponse joinByIdentifier(String groupIdentifier, Long userId, Long selectedListId) {
        GroupResponse group = groupService.findByIdentifier(groupIdentifier);
        log.debug("Join identifier {} resolved to groupId={}", groupIdentifier, group.getId());
        return requestToJoin(group.getId(), userId, selectedListId);
    }

    @Override
    @Transactional
    public MembershipResponse invite(Long groupId, Long leaderId, String identifier) {
        log.info("Invite: groupId={}, leaderId={}, identifier={}", groupId, leaderId, identifier);

        requireLeader(groupId, leaderId);
        User invitee = userRepository.findByUsernameOrEmail(identifier.trim())
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(identifier));

        Optional<Membership> existing = membershipRepository.findByGroupIdAndUserId(groupId, invitee.getId());
        if (existing.isEmpty()) {
            Membership created = createMembership(groupId, invitee.getId(), MembershipAction.INVITE, null);
            log.info("Invite created: groupId={}, userId={}", groupId, invitee.getId());
            return toResponse(created, ActionOutcome.APPLIED);
        }

        Membership membership = existing.get();

        MembershipState previous = membership.getState();
        membership.transition(MembershipAction.INVITE);
        linkIfApproved(membership, previous);

        log.info("Invite: groupId={}, userId={}, {} -> {}", groupId, invitee.getId(), previous, membership.getState());
        return toResponse(membership, outcomeOf(previous, membership.getState()));
    }

    @Override
    @Transactional
    public MembershipResponse approve(Long groupId, Long leaderId, Long userId) {
        log.info("Approve: groupId={}, leaderId={}, userId={}", groupId, leaderId, userId);

        requireLeader(groupId, leaderId);
        Membership membership = requireMembership(groupId, userId);

        MembershipState previous = membership.getState();
        membership.transition(MembershipAction.APPROVE);
        linkIfApproved(membership, previous);

        log.info("Member approved: groupId={}, userId={}", groupId, userId);
        return toResponse(membership, outcomeOf(previous, membership.getState()));
    }

    @Override
    @Transactional
    public MembershipResponse deny(Long groupId, Long leaderId, Long userId) {
        log.info("Deny: groupId={}, leaderId={}, userId={}", groupId, leaderId, userId);

        requireLeader(groupId, leaderId);
        Membership membership = requireMembership(groupId, userId);
        membership.transition(MembershipAction.DENY);

        log.info("Member denied: groupId={}, userId={}", groupId, userId);
        return toResponse(membership, ActionOutcome.APPLIED);
    }

    @Override
    @Transactional
    public MembershipResponse accept(Long groupId, Long userId, Long selectedListId) {
        log.info("Accept invite: groupId={}, userId={}, listId={}", groupId, userId, selectedListId);

        Membership membership = requireMembership(groupId, userId);
        GiftList list = requireOwnedList(selectedListId, userId);

        MembershipState previous = membership.getState();
        membership.transition(MembershipAction.ACCEPT);
        ActionOutcome outcome = outcomeOf(previous, membership.getState());
        if (outcome == ActionOutcome.APPLIED) {
            membership.setSelectedListId(list.getId());
            linkIfApproved(membership, previous);
        }

        log.info("Invite accepted: groupId={}, userId={}", groupId, userId);
        return toResponse(membership, outcome);
    }

    @Override
    @Transactional
    public MembershipResponse decline(Long groupId, Long userId) {
        return removeOwnRow(groupId, userId, MembershipAction.DECLINE);
    }

    @Override
    @Transactional
    public MembershipResponse removeDenied(Long groupId, Long userId) {
        return removeOwnRow(groupId, userId, MembershipAction.REMOVE);
    }

    @Override
    @Transactional
    public MembershipResponse leave(Long groupId, Long userId) {
        log.info("Leave: groupId={}, userId={}", groupId, userId);

        Membership membership = requireMembership(groupId, userId);
        membership.transition(MembershipAction.LEAVE);
        CascadeReport cascade = lifecycleService.removeMember(groupId, userId);

        log.info("Member left: groupId={}, userId={}", groupId, userId);
        return removedResponse(groupId, userId, ActionOutcome.APPLIED, cascade);
    }

    @Override
    @Transactional
    public MembershipResponse kick(Long groupId, Long leaderId, Long userId) {
        log.info("Kick: groupId={}, leaderId={}, userId={}", groupId, leaderId, userId);

        requireLeader(groupId, leaderId);
        Membership membership = requireMembership(groupId, userId);
        membership.transition(MembershipAction.KICK);
        CascadeReport cascade = lifecycleService.removeMember(groupId, userId);

        log.info("Member kicked: groupId={}, userId={}", groupId, userId);
        return removedResponse(groupId, userId, ActionOutcome.APPLIED, cascade);
    }

    private MembershipResponse removeOwnRow(Long groupId, Long userId, MembershipAction action) {
        log.info("{}: groupId={}, userId={}", action, groupId, userId);

        Optional<Membership> existing = membershipRepository.findByGroupIdAndUserId(groupId, userId);
        if (existing.isEmpty()) {
            log.info("{}: nothing to remove for groupId={}, userId={}", action, groupId, userId);
            return removedResponse(groupId, userId, ActionOutcome.NOTHING_TO_REMOVE, null);
        }

        existing.get().transition(action);
        CascadeReport cascade = lifecycleService.removeMember(groupId, userId);
        return removedResponse(groupId, userId, ActionOutcome.APPLIED, cascade);
    }

    private Membership createMembership(Long groupId, Long userId, MembershipAction action, Long selectedListId) {
        Membership membership = Membership.builder()
                .groupId(groupId)
                .userId(userId)
                .state(MembershipState.initial(action))
                .selectedListId(selectedListId)
                .build();
        try {
            return membershipRepository.saveAndFlush(membership);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent membership insert: groupId={}, userId={}", groupId, userId);
            throw ConflictException.concurrentMembershipChange(userId, groupId);
        }
    }

    /**
     * Link the member's selected list when this transition made them approved.
     */
    private void linkIfApproved(Membership membership, MembershipState previous) {
        if (previous.isApproved() || !membership.isApproved()) {
            return;
        }
        Long listId = membership.getSelectedListId();
        if (listId != null && !listGroupRepository.existsByGroupIdAndListId(membership.getGroupId(), listId)) {
            listGroupRepository.save(ListGroup.builder()
                    .groupId(membership.getGroupId())
                    .listId(listId)
                    .build());
            log.info("List {} linked into group {}", listId, membership.getGroupId());
        }
    }

    private static ActionOutcome outcomeOf(MembershipState previous, MembershipState next) {
        if (previous != next) {
            return ActionOutcome.APPLIED;
        }
        return switch (next) {
            case PENDING_REQUEST -> ActionOutcome.ALREADY_PENDING;
            case PENDING_INVITE -> ActionOutcome.ALREADY_INVITED;
            case APPROVED, LEADER -> ActionOutcome.ALREADY_MEMBER;
            case DENIED -> ActionOutcome.APPLIED;
        };
    }

    private Group requireGroup(Long groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> ResourceNotFoundException.groupNotFound(groupId));
    }

    private Group requireLeader(Long groupId, Long userId) {
        Group group = requireGroup(groupId);
        if (!group.isLedBy(userId)) {
            throw ForbiddenException.leaderOnly();
        }
        return group;
    }

    private Membership requireMembership(Long groupId, Long userId) {
        return membershipRepository.findByGroupIdAndUserId(groupId, userId)
                .orElseThrow(() -> ResourceNotFoundException.membershipNotFound(userId, groupId));
    }

    private GiftList requireOwnedList(Long listId, Long userId) {
        if (listId == null) {
            throw InvalidSelectionException.listRequired();
        }
        return giftListRepository.findById(listId)
                .filter(list -> list.isOwnedBy(userId))
                .orElseThrow(() -> InvalidSelectionException.listNotOwned(listId));
    }

    private MembershipResponse toResponse(Membership membership, ActionOutcome outcome) {
        return MembershipResponse.builder()
                .groupId(membership.getGroupId())
                .userId(membership.getUserId())
                .state(membership.getState())
                .outcome(outcome)
                .build();
    }

    private MembershipResponse removedResponse(Long groupId, Long userId, ActionOutcome outcome,
                                               CascadeReport cascade) {
        return MembershipResponse.builder()
                .groupId(groupId)
                .userId(userId)
                .outcome(outcome)
                .cascade(cascade)
                .build();
    }
}
