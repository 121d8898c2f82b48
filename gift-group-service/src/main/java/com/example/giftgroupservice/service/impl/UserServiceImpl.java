package com.example.giftgroupservice.service.impl;

import com.example.giftgroupservice.dto.request.RegisterUserRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.DashboardResponse;
import com.example.giftgroupservice.dto.response.GiftListResponse;
import com.example.giftgroupservice.dto.response.GroupResponse;
import com.example.giftgroupservice.dto.response.UserResponse;
import com.example.giftgroupservice.entity.GiftList;
import com.example.giftgroupservice.entity.Group;
import com.example.giftgroupservice.entity.ListGroup;
import com.example.giftgroupservice.entity.User;
import com.example.giftgroupservice.exception.ConflictException;
import com.example.giftgroupservice.exception.UnauthorizedException;
import com.example.giftgroupservice.repository.GiftListRepository;
import com.example.giftgroupservice.repository.GroupRepository;
import com.example.giftgroupservice.repository.ListGroupRepository;
import com.example.giftgroupservice.repository.UserRepository;
import com.example.giftgroupservice.service.ClaimService;
import com.example.giftgroupservice.service.GroupLifecycleService;
import com.example.giftgroupservice.service.GroupService;
import com.example.giftgroupservice.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of UserService.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;
    private final GiftListRepository giftListRepository;
    private final ListGroupRepository listGroupRepository;
    private final GroupRepository groupRepository;
    private final GroupService groupService;
    private final ClaimService claimService;
    private final GroupLifecycleService lifecycleService;

    @Override
    @Transactional
    public UserResponse register(Long userId, RegisterUserRequest request) {
        String username = request.getUsername().trim();
        String email = request.getEmail().trim();
        log.info("Registering profile: userId={}, username={}", userId, username);

        if (userRepository.existsById(userId)) {
            throw ConflictException.profileAlreadyExists(userId);
        }
        if (userRepository.existsByUsername(username)) {
            throw ConflictException.usernameTaken(username);
        }
        if (userRepository.existsByEmail(email)) {
            throw ConflictException.emailTaken(email);
        }

        User user = User.builder()
                .id(userId)
                .username(username)
                .email(email)
                .build();
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent registration: userId={}, username={}", userId, username);
            throw ConflictException.usernameTaken(username);
        }

        log.info("Profile registered: userId={}", userId);
        return UserResponse.from(user);
    }

    @Override
    public UserResponse getProfile(Long userId) {
        return UserResponse.from(findUser(userId));
    }

    @Override
    public DashboardResponse getDashboard(Long userId) {
        User user = findUser(userId);

        List<GiftList> lists = giftListRepository.findAllByOwnerIdOrderByCreatedAtAsc(userId);
        List<ListGroup> links = lists.isEmpty()
                ? List.of()
                : listGroupRepository.findAllByListIdIn(lists.stream().map(GiftList::getId).toList());
        Map<Long, Group> groups = groupRepository.findAllById(
                        links.stream().map(ListGroup::getGroupId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(Group::getId, Function.identity()));

        Map<Long, List<GroupResponse>> groupsForList = new LinkedHashMap<>();
        for (GiftList list : lists) {
            groupsForList.put(list.getId(), new ArrayList<>());
        }
        for (ListGroup link : links) {
            Group group = groups.get(link.getGroupId());
            if (group != null) {
                groupsForList.get(link.getListId()).add(GroupResponse.from(group));
            }
        }

        return DashboardResponse.builder()
                .user(UserResponse.from(user))
                .lists(lists.stream().map(GiftListResponse::from).toList())
                .groups(groupService.getMyGroups(userId))
                .groupsForList(groupsForList)
                .giftsImGiving(claimService.myClaims(userId))
                .build();
    }

    @Override
    @Transactional
    public CascadeReport deleteAccount(Long userId) {
        log.info("Deleting account: userId={}", userId);
        CascadeReport report = lifecycleService.deleteAccount(userId);
        log.info("Account deleted: userId={}, rows={}", userId, report.totalRows());
        return report;
    }

    private User findUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> UnauthorizedException.profileNotRegistered(userId));
    }
}
