package com.example.giftgroupservice.entity;

import com.example.giftgroupservice.exception.InvalidOperationException;

import java.util.Optional;

/**
 * Membership state of one user in one group.
 *
 * All moves go through {@link #apply(MembershipAction)}; anything not listed there is
 * rejected with {@link InvalidOperationException}.
 *
 * <pre>
 * (none)          --REQUEST--> PENDING_REQUEST
 * (none)          --INVITE---> PENDING_INVITE
 * PENDING_REQUEST --APPROVE--> APPROVED     --DENY--> DENIED
 * PENDING_REQUEST --INVITE---> APPROVED     --LEAVE/KICK--> removed
 * PENDING_INVITE  --ACCEPT---> APPROVED     --REQUEST--> APPROVED
 * PENDING_INVITE  --DECLINE/KICK--> removed
 * DENIED          --REQUEST--> PENDING_REQUEST  --INVITE--> PENDING_INVITE
 * DENIED          --REMOVE/KICK--> removed
 * APPROVED        --LEAVE/KICK--> removed
 * LEADER          --REQUEST/INVITE/APPROVE/ACCEPT--> LEADER, everything else rejected
 * </pre>
 * Re-sending REQUEST or INVITE to a row already in the target state returns the same state,
 * and REQUEST, INVITE, APPROVE or ACCEPT on an approved or leader row keeps it as it is.
 */
public enum MembershipState {
    LEADER,
    PENDING_REQUEST,
    PENDING_INVITE,
    APPROVED,
    DENIED;

    /**
     * State of a freshly created membership row.
     */
    public static MembershipState initial(MembershipAction action) {
        return switch (action) {
            case REQUEST -> PENDING_REQUEST;
            case INVITE -> PENDING_INVITE;
            default -> throw InvalidOperationException.noMembership(action);
        };
    }

    /**
     * Apply an action to this state.
     *
     * @return the next state, or empty when the action removes the membership
     * @throws InvalidOperationException if the action is not allowed from this state
     */
    public Optional<MembershipState> apply(MembershipAction action) {
        Optional<MembershipState> next = switch (this) {
            case LEADER -> switch (action) {
                case REQUEST, INVITE, APPROVE, ACCEPT -> Optional.of(LEADER);
                default -> null;
            };
            case PENDING_REQUEST -> switch (action) {
                case REQUEST -> Optional.of(PENDING_REQUEST);
                case APPROVE, INVITE -> Optional.of(APPROVED);
                case DENY -> Optional.of(DENIED);
                case LEAVE, KICK -> Optional.empty();
                default -> null;
            };
            case PENDING_INVITE -> switch (action) {
                case INVITE -> Optional.of(PENDING_INVITE);
                case ACCEPT, REQUEST -> Optional.of(APPROVED);
                case DECLINE, KICK -> Optional.empty();
                default -> null;
            };
            case APPROVED -> switch (action) {
                case REQUEST, INVITE, APPROVE, ACCEPT -> Optional.of(APPROVED);
                case LEAVE, KICK -> Optional.empty();
                default -> null;
            };
            case DENIED -> switch (action) {
                case REQUEST -> Optional.of(PENDING_REQUEST);
                case INVITE -> Optional.of(PENDING_INVITE);
                case REMOVE, KICK -> Optional.empty();
                default -> null;
            };
        };
        if (next == null) {
            if (this == LEADER) {
                throw InvalidOperationException.leaderCannot(action);
            }
            throw InvalidOperationException.illegalTransition(this, action);
        }
        return next;
    }

    /**
     * Leader and approved members can view the group and claim in it.
     */
    public boolean isApproved() {
        return this == LEADER || this == APPROVED;
    }

    public boolean isPending() {
        return this == PENDING_REQUEST || this == PENDING_INVITE;
    }
}
