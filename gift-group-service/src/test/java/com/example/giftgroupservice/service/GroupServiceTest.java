package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.request.CreateGroupRequest;
import com.example.giftgroupservice.dto.response.DashboardResponse;
import com.example.giftgroupservice.dto.response.GiftListResponse;
import com.example.giftgroupservice.dto.response.GroupManageResponse;
import com.example.giftgroupservice.dto.response.GroupResponse;
import com.example.giftgroupservice.dto.response.GroupViewResponse;
import com.example.giftgroupservice.dto.response.ItemResponse;
import com.example.giftgroupservice.dto.response.MemberResponse;
import com.example.giftgroupservice.dto.response.MyGroupResponse;
import com.example.giftgroupservice.entity.MembershipState;
import com.example.giftgroupservice.exception.ConflictException;
import com.example.giftgroupservice.exception.ForbiddenException;
import com.example.giftgroupservice.exception.InvalidSelectionException;
import com.example.giftgroupservice.exception.ResourceNotFoundException;
import com.example.giftgroupservice.repository.ListGroupRepository;
import com.example.giftgroupservice.repository.MembershipRepository;
import com.example.giftgroupservice.support.EngineTest;
import com.example.giftgroupservice.support.GiftGroupFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@EngineTest
class GroupServiceTest {

    @Autowired
    private GroupService groupService;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private ClaimService claimService;

    @Autowired
    private UserService userService;

    @Autowired
    private MembershipRepository membershipRepository;

    @Autowired
    private ListGroupRepository listGroupRepository;

    @Autowired
    private GiftGroupFixtures fixtures;

    private Long leader;
    private Long bob;
    private Long carol;
    private Long leaderList;
    private Long bobList;
    private Long carolList;

    @BeforeEach
    void setUp() {
        leader = fixtures.user(40L, "leader");
        bob = fixtures.user(41L, "bob");
        carol = fixtures.user(42L, "carol");
        leaderList = fixtures.list(leader, "Leader list");
        bobList = fixtures.list(bob, "Bob list");
        carolList = fixtures.list(carol, "Carol list");
    }

    /**
     * Scenario "Cabin": creation makes the leader an approved member and shows the list.
     */
    @Test
    void createGroup_leaderMembershipAndLink() {
        Long cabin = fixtures.group(leader, "Cabin", leaderList);

        assertThat(membershipRepository.findByGroupIdAndUserId(cabin, leader))
                .hasValueSatisfying(m -> {
                    assertThat(m.getState()).isEqualTo(MembershipState.LEADER);
                    assertThat(m.isApproved()).isTrue();
                });
        assertThat(listGroupRepository.existsByGroupIdAndListId(cabin, leaderList)).isTrue();
    }

    @Test
    void createGroup_nameIsUniqueIgnoringCase() {
        fixtures.group(leader, "Cabin", leaderList);

        CreateGroupRequest duplicate = CreateGroupRequest.builder().name("  cABIN ").selectedListId(bobList).build();
        assertThatThrownBy(() -> groupService.createGroup(bob, duplicate))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("GROUP_NAME_DUPLICATE");
    }

    @Test
    void createGroup_withForeignListIsInvalidSelection() {
        CreateGroupRequest request = CreateGroupRequest.builder().name("Cabin").selectedListId(bobList).build();

        assertThatThrownBy(() -> groupService.createGroup(leader, request))
                .isInstanceOf(InvalidSelectionException.class);
    }

    @Test
    void groupView_filteredForViewer() {
        // GIVEN: Cabin with bob and carol; carol surprises bob; bob claims carol's book
        Long cabin = fixtures.group(leader, "Cabin", leaderList);
        fixtures.approvedMember(cabin, leader, bob, bobList);
        fixtures.approvedMember(cabin, leader, carol, carolList);
        Long socks = fixtures.item(bobList, bob, "Socks");
        Long book = fixtures.item(carolList, carol, "Book");
        Long scarf = fixtures.surpriseItem(cabin, bobList, carol, "Scarf");
        claimService.claim(cabin, book, bob);

        // WHEN
        GroupViewResponse forBob = groupService.getGroupView(cabin, bob);
        GroupViewResponse forCarol = groupService.getGroupView(cabin, carol);

        // THEN: bob sees his own list without the surprise
        assertThat(forBob.getVisibleLists()).extracting(GiftListResponse::getId)
                .containsExactlyInAnyOrder(leaderList, bobList, carolList);
        assertThat(forBob.getItemsByList().get(bobList)).extracting(ItemResponse::getId).containsExactly(socks);
        assertThat(forBob.getMyClaimedItemIds()).containsExactly(book);
        // the claimed scarf is not even hinted at
        assertThat(forBob.getClaimedItemIds()).containsExactly(book).doesNotContain(scarf);

        // THEN: carol sees the surprise and both claims
        assertThat(forCarol.getItemsByList().get(bobList)).extracting(ItemResponse::getId)
                .containsExactlyInAnyOrder(socks, scarf);
        assertThat(forCarol.getClaimedItemIds()).containsExactlyInAnyOrder(book, scarf);
        assertThat(forCarol.getMyClaimedItemIds()).containsExactly(scarf);
        assertThat(forCarol.getMembers()).extracting(MemberResponse::getUsername)
                .containsExactlyInAnyOrder("leader", "bob", "carol");
    }

    @Test
    void groupView_pendingMemberIsForbidden() {
        Long cabin = fixtures.group(leader, "Cabin", leaderList);
        membershipService.requestToJoin(cabin, bob, bobList);

        assertThatThrownBy(() -> groupService.getGroupView(cabin, bob))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> groupService.getGroupView(9999L, bob))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void manageView_groupsMembershipsByState() {
        Long cabin = fixtures.group(leader, "Cabin", leaderList);
        membershipService.requestToJoin(cabin, bob, bobList);
        membershipService.invite(cabin, leader, "carol");

        GroupManageResponse view = groupService.getManageView(cabin, leader);

        assertThat(view.getPendingRequests()).extracting(MemberResponse::getUserId).containsExactly(bob);
        assertThat(view.getPendingRequests().get(0).getSelectedListName()).isEqualTo("Bob list");
        assertThat(view.getPendingInvites()).extracting(MemberResponse::getUserId).containsExactly(carol);
        assertThat(view.getDenied()).isEmpty();
        assertThat(view.getApproved()).extracting(MemberResponse::getUserId).containsExactly(leader);

        assertThatThrownBy(() -> groupService.getManageView(cabin, bob))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void searchAndIdentifierLookup() {
        Long cabin = fixtures.group(leader, "Cabin Trip", leaderList);
        fixtures.group(bob, "Office Party", bobList);

        assertThat(groupService.searchGroups("trip")).extracting(GroupResponse::getName).containsExactly("Cabin Trip");
        assertThat(groupService.searchGroups(String.valueOf(cabin))).extracting(GroupResponse::getId)
                .containsExactly(cabin);
        assertThat(groupService.searchGroups("   ")).isEmpty();

        assertThat(groupService.findByIdentifier("cabin trip").getId()).isEqualTo(cabin);
        assertThat(groupService.findByIdentifier(String.valueOf(cabin)).getName()).isEqualTo("Cabin Trip");
        assertThatThrownBy(() -> groupService.findByIdentifier("cabin"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void myGroupsAndDashboard() {
        Long cabin = fixtures.group(leader, "Cabin", leaderList);
        Long office = fixtures.group(carol, "Office", carolList);
        fixtures.approvedMember(cabin, leader, bob, bobList);
        membershipService.requestToJoin(office, bob, bobList);
        Long book = fixtures.item(carolList, carol, "Book");
        fixtures.approvedMember(cabin, leader, carol, carolList);
        claimService.claim(cabin, book, bob);

        assertThat(groupService.getMyGroups(bob))
                .extracting(g -> g.getGroup().getName(), MyGroupResponse::getState)
                .containsExactly(
                        tuple("Cabin", MembershipState.APPROVED),
                        tuple("Office", MembershipState.PENDING_REQUEST));

        DashboardResponse dashboard = userService.getDashboard(bob);
        assertThat(dashboard.getLists()).extracting(GiftListResponse::getId).containsExactly(bobList);
        assertThat(dashboard.getGroupsForList().get(bobList)).extracting(GroupResponse::getId).containsExactly(cabin);
        assertThat(dashboard.getGiftsImGiving()).singleElement()
                .satisfies(claim -> assertThat(claim.getItemName()).isEqualTo("Book"));
    }

    @Test
    void deleteGroup_leaderOnly() {
        Long cabin = fixtures.group(leader, "Cabin", leaderList);
        fixtures.approvedMember(cabin, leader, bob, bobList);

        assertThatThrownBy(() -> groupService.deleteGroup(cabin, bob))
                .isInstanceOf(ForbiddenException.class);

        assertThat(groupService.deleteGroup(cabin, leader).getGroups()).containsExactly(cabin);
    }
}
