package com.example.giftgroupservice.service.impl;

import com.example.giftgroupservice.entity.GiftList;
import com.example.giftgroupservice.entity.Group;
import com.example.giftgroupservice.entity.Membership;
import com.example.giftgroupservice.exception.ConflictException;
import com.example.giftgroupservice.exception.InvalidSelectionException;
import com.example.giftgroupservice.repository.GiftListRepository;
import com.example.giftgroupservice.repository.GroupRepository;
import com.example.giftgroupservice.repository.ListGroupRepository;
import com.example.giftgroupservice.repository.MembershipRepository;
import com.example.giftgroupservice.repository.UserRepository;
import com.example.giftgroupservice.service.GroupLifecycleService;
import com.example.giftgroupservice.service.GroupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MembershipServiceImpl Tests")
class MembershipServiceImplTest {

    private static final Long GROUP_ID = 5L;
    private static final Long LEADER_ID = 1L;
    private static final Long USER_ID = 4L;
    private static final Long LIST_ID = 60L;

    @Mock private MembershipRepository membershipRepository;
    @Mock private GroupRepository groupRepository;
    @Mock private GiftListRepository giftListRepository;
    @Mock private ListGroupRepository listGroupRepository;
    @Mock private UserRepository userRepository;
    @Mock private GroupLifecycleService lifecycleService;
    @Mock private GroupService groupService;

    private MembershipServiceImpl membershipService;

    @BeforeEach
    void setUp() {
        membershipService = new MembershipServiceImpl(membershipRepository, groupRepository, giftListRepository,
                listGroupRepository, userRepository, lifecycleService, groupService);
    }

    @Test
    @DisplayName("requestToJoin() maps a duplicate (group, user) insert to MEMBERSHIP_CONFLICT")
    void requestToJoin_concurrentInsert() {
        // Given: no row at read time, but another transaction inserts first
        when(groupRepository.findById(GROUP_ID)).thenReturn(Optional.of(group()));
        when(giftListRepository.findById(LIST_ID)).thenReturn(Optional.of(
                GiftList.builder().id(LIST_ID).ownerId(USER_ID).name("Mine").build()));
        when(membershipRepository.findByGroupIdAndUserId(GROUP_ID, USER_ID)).thenReturn(Optional.empty());
        when(membershipRepository.saveAndFlush(any(Membership.class)))
                .thenThrow(new DataIntegrityViolationException("uq_membership_group_user"));

        // When & Then
        assertThatThrownBy(() -> membershipService.requestToJoin(GROUP_ID, USER_ID, LIST_ID))
                .isInstanceOf(ConflictException.class)
                .extracting("code")
                .isEqualTo("MEMBERSHIP_CONFLICT");
        verify(listGroupRepository, never()).save(any());
    }

    @Test
    @DisplayName("requestToJoin() refuses a list the caller does not own")
    void requestToJoin_foreignList() {
        // Given
        when(groupRepository.findById(GROUP_ID)).thenReturn(Optional.of(group()));
        when(giftListRepository.findById(LIST_ID)).thenReturn(Optional.of(
                GiftList.builder().id(LIST_ID).ownerId(99L).name("Not mine").build()));

        // When & Then
        assertThatThrownBy(() -> membershipService.requestToJoin(GROUP_ID, USER_ID, LIST_ID))
                .isInstanceOf(InvalidSelectionException.class);
        verify(membershipRepository, never()).saveAndFlush(any());
    }

    private static Group group() {
        return Group.builder().id(GROUP_ID).name("Cabin").nameKey("cabin").leaderId(LEADER_ID).build();
    }
}
