package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.response.ActionOutcome;
import com.example.giftgroupservice.dto.response.ClaimResponse;
import com.example.giftgroupservice.exception.ConflictException;
import com.example.giftgroupservice.exception.ForbiddenException;
import com.example.giftgroupservice.exception.ResourceNotFoundException;
import com.example.giftgroupservice.repository.ClaimRepository;
import com.example.giftgroupservice.support.EngineTest;
import com.example.giftgroupservice.support.GiftGroupFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Claim engine: one claimer per item per group, independent across groups.
 */
@EngineTest
class ClaimServiceTest {

    @Autowired
    private ClaimService claimService;

    @Autowired
    private ClaimRepository claimRepository;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private GiftGroupFixtures fixtures;

    private Long leader;
    private Long bob;
    private Long carol;
    private Long dave;
    private Long bobList;
    private Long socks;
    private Long cabin;
    private Long office;

    @BeforeEach
    void setUp() {
        leader = fixtures.user(10L, "leader");
        bob = fixtures.user(11L, "bob");
        carol = fixtures.user(12L, "carol");
        dave = fixtures.user(13L, "dave");

        Long leaderList = fixtures.list(leader, "Leader list");
        bobList = fixtures.list(bob, "Bob list");
        Long carolList = fixtures.list(carol, "Carol list");
        Long daveList = fixtures.list(dave, "Dave list");

        cabin = fixtures.group(leader, "Cabin", leaderList);
        fixtures.approvedMember(cabin, leader, bob, bobList);
        fixtures.approvedMember(cabin, leader, carol, carolList);
        fixtures.approvedMember(cabin, leader, dave, daveList);

        office = fixtures.group(leader, "Office", leaderList);
        fixtures.approvedMember(office, leader, bob, bobList);
        fixtures.approvedMember(office, leader, dave, daveList);

        socks = fixtures.item(bobList, bob, "Socks");
    }

    /**
     * Scenario "Office": conflict inside one group, independent claim in another.
     */
    @Test
    void office_claimsAreIndependentPerGroup() {
        // GIVEN: carol claims Socks in Cabin
        assertThat(claimService.claim(cabin, socks, carol).getOutcome()).isEqualTo(ActionOutcome.APPLIED);

        // WHEN/THEN: dave cannot claim the same item in Cabin
        assertThatThrownBy(() -> claimService.claim(cabin, socks, dave))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("ITEM_ALREADY_CLAIMED");

        // WHEN/THEN: dave can claim it in Office, where bob's list is also shown
        assertThat(claimService.claim(office, socks, dave).getOutcome()).isEqualTo(ActionOutcome.APPLIED);

        assertThat(claimRepository.findByItemIdAndGroupId(socks, cabin))
                .hasValueSatisfying(c -> assertThat(c.getClaimerId()).isEqualTo(carol));
        assertThat(claimRepository.findByItemIdAndGroupId(socks, office))
                .hasValueSatisfying(c -> assertThat(c.getClaimerId()).isEqualTo(dave));
    }

    @Test
    void claim_twiceBySameUserReportsAlreadyClaimedByYou() {
        claimService.claim(cabin, socks, carol);

        assertThatThrownBy(() -> claimService.claim(cabin, socks, carol))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("ITEM_ALREADY_CLAIMED_BY_YOU");
        assertThat(claimRepository.findAllByGroupId(cabin)).hasSize(1);
    }

    @Test
    void claim_ownItemIsForbidden() {
        assertThatThrownBy(() -> claimService.claim(cabin, socks, bob))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("CANNOT_CLAIM_OWN_ITEM");
    }

    @Test
    void claim_requiresApprovedMembership() {
        // carol is not in Office
        assertThatThrownBy(() -> claimService.claim(office, socks, carol))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_APPROVED_MEMBER");

        // pending members cannot claim either
        Long erin = fixtures.user(14L, "erin");
        membershipService.requestToJoin(office, erin, fixtures.list(erin, "Erin list"));
        assertThatThrownBy(() -> claimService.claim(office, socks, erin))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void claim_leaderCanClaim() {
        assertThat(claimService.claim(cabin, socks, leader).getOutcome()).isEqualTo(ActionOutcome.APPLIED);
    }

    @Test
    void claim_itemOfListNotShownInGroupIsNotFound() {
        // a second list of carol's that was never selected for any group
        Long privateList = fixtures.list(carol, "Carol private");
        Long hidden = fixtures.item(privateList, carol, "Book");

        assertThatThrownBy(() -> claimService.claim(cabin, hidden, dave))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void claim_surpriseScopedToOtherGroupIsNotFound() {
        Long surprise = fixtures.surpriseItem(cabin, bobList, carol, "Scarf");

        assertThatThrownBy(() -> claimService.claim(office, surprise, dave))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void claim_unknownItemIsNotFound() {
        assertThatThrownBy(() -> claimService.claim(cabin, 9999L, carol))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void unclaim_secondCallIsNoOp() {
        claimService.claim(cabin, socks, carol);

        assertThat(claimService.unclaim(cabin, socks, carol).getOutcome()).isEqualTo(ActionOutcome.APPLIED);
        assertThat(claimService.unclaim(cabin, socks, carol).getOutcome())
                .isEqualTo(ActionOutcome.NOTHING_TO_REMOVE);
        assertThat(claimRepository.findByItemIdAndGroupId(socks, cabin)).isEmpty();
    }

    @Test
    void unclaim_someoneElsesClaimIsLeftAlone() {
        claimService.claim(cabin, socks, carol);

        assertThat(claimService.unclaim(cabin, socks, dave).getOutcome())
                .isEqualTo(ActionOutcome.NOTHING_TO_REMOVE);
        assertThat(claimRepository.findByItemIdAndGroupId(socks, cabin)).isPresent();
    }

    @Test
    void projections_perGroupAndAcrossGroups() {
        Long gloves = fixtures.item(bobList, bob, "Gloves");
        claimService.claim(cabin, socks, carol);
        claimService.claim(cabin, gloves, dave);
        claimService.claim(office, socks, dave);

        assertThat(claimService.claimedItemIds(cabin)).containsExactlyInAnyOrder(socks, gloves);
        assertThat(claimService.myClaimedItemIds(cabin, dave)).containsExactly(gloves);
        assertThat(claimService.myClaimedItemIds(office, dave)).containsExactly(socks);

        List<ClaimResponse> daveClaims = claimService.myClaims(dave);
        assertThat(daveClaims).hasSize(2);
        assertThat(daveClaims).extracting(ClaimResponse::getGroupName)
                .containsExactlyInAnyOrder("Cabin", "Office");
        assertThat(daveClaims).allSatisfy(claim -> {
            assertThat(claim.getRecipientId()).isEqualTo(bob);
            assertThat(claim.getListName()).isEqualTo("Bob list");
        });
    }
}
