package com.example.giftgroupservice.entity;

import com.example.giftgroupservice.exception.InvalidOperationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MembershipStateTest {

    @Test
    void initialState_requestAndInviteOnly() {
        assertThat(MembershipState.initial(MembershipAction.REQUEST)).isEqualTo(MembershipState.PENDING_REQUEST);
        assertThat(MembershipState.initial(MembershipAction.INVITE)).isEqualTo(MembershipState.PENDING_INVITE);

        assertThatThrownBy(() -> MembershipState.initial(MembershipAction.APPROVE))
                .isInstanceOf(InvalidOperationException.class);
    }

    @Test
    void pendingRequest_approveDenyOrConverge() {
        assertThat(MembershipState.PENDING_REQUEST.apply(MembershipAction.APPROVE)).contains(MembershipState.APPROVED);
        assertThat(MembershipState.PENDING_REQUEST.apply(MembershipAction.DENY)).contains(MembershipState.DENIED);
        assertThat(MembershipState.PENDING_REQUEST.apply(MembershipAction.INVITE)).contains(MembershipState.APPROVED);
        assertThat(MembershipState.PENDING_REQUEST.apply(MembershipAction.REQUEST)).contains(MembershipState.PENDING_REQUEST);
        assertThat(MembershipState.PENDING_REQUEST.apply(MembershipAction.LEAVE)).isEmpty();
    }

    @Test
    void pendingInvite_acceptOrDecline() {
        assertThat(MembershipState.PENDING_INVITE.apply(MembershipAction.ACCEPT)).contains(MembershipState.APPROVED);
        assertThat(MembershipState.PENDING_INVITE.apply(MembershipAction.REQUEST)).contains(MembershipState.APPROVED);
        assertThat(MembershipState.PENDING_INVITE.apply(MembershipAction.DECLINE)).isEmpty();

        // the leader cannot approve on the invitee's behalf
        assertThatThrownBy(() -> MembershipState.PENDING_INVITE.apply(MembershipAction.APPROVE))
                .isInstanceOf(InvalidOperationException.class);
    }

    @Test
    void denied_canAskAgainOrRemove() {
        assertThat(MembershipState.DENIED.apply(MembershipAction.REQUEST)).contains(MembershipState.PENDING_REQUEST);
        assertThat(MembershipState.DENIED.apply(MembershipAction.INVITE)).contains(MembershipState.PENDING_INVITE);
        assertThat(MembershipState.DENIED.apply(MembershipAction.REMOVE)).isEmpty();

        assertThatThrownBy(() -> MembershipState.DENIED.apply(MembershipAction.ACCEPT))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("DENIED");
    }

    @Test
    void approved_repeatedJoinActionsAreNoOps() {
        for (MembershipAction action : new MembershipAction[]{
                MembershipAction.REQUEST, MembershipAction.INVITE, MembershipAction.APPROVE, MembershipAction.ACCEPT}) {
            assertThat(MembershipState.APPROVED.apply(action)).contains(MembershipState.APPROVED);
        }
        assertThat(MembershipState.APPROVED.apply(MembershipAction.LEAVE)).isEmpty();

        assertThatThrownBy(() -> MembershipState.APPROVED.apply(MembershipAction.DENY))
                .isInstanceOf(InvalidOperationException.class);
    }

    @ParameterizedTest
    @EnumSource(value = MembershipAction.class, names = {"REQUEST", "INVITE", "APPROVE", "ACCEPT"})
    void leader_joinActionsKeepLeader(MembershipAction action) {
        assertThat(MembershipState.LEADER.apply(action)).contains(MembershipState.LEADER);
    }

    @ParameterizedTest
    @EnumSource(value = MembershipAction.class, names = {"REQUEST", "INVITE", "APPROVE", "ACCEPT"},
            mode = EnumSource.Mode.EXCLUDE)
    void leader_neverLeavesOrIsRemoved(MembershipAction action) {
        assertThatThrownBy(() -> MembershipState.LEADER.apply(action))
                .isInstanceOf(InvalidOperationException.class)
                .satisfies(ex -> {
                    String expectedCode = action == MembershipAction.LEAVE
                            ? "LEADER_CANNOT_LEAVE" : "LEADER_MEMBERSHIP_IMMUTABLE";
                    assertThat(((InvalidOperationException) ex).getCode()).isEqualTo(expectedCode);
                });
    }

    @ParameterizedTest
    @EnumSource(value = MembershipState.class, names = {"PENDING_REQUEST", "PENDING_INVITE", "APPROVED", "DENIED"})
    void kick_removesEveryNonLeaderState(MembershipState state) {
        assertThat(state.apply(MembershipAction.KICK)).isEqualTo(Optional.empty());
    }

    @Test
    void membershipTransition_reportsRemoval() {
        Membership membership = Membership.builder().state(MembershipState.PENDING_REQUEST).build();

        assertThat(membership.transition(MembershipAction.APPROVE)).isFalse();
        assertThat(membership.getState()).isEqualTo(MembershipState.APPROVED);
        assertThat(membership.isApproved()).isTrue();

        assertThat(membership.transition(MembershipAction.KICK)).isTrue();
        // a removing action leaves the in-memory state untouched; the row is deleted by the caller
        assertThat(membership.getState()).isEqualTo(MembershipState.APPROVED);
    }
}
