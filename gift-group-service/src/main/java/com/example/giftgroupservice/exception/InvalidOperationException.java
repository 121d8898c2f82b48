package com.example.giftgroupservice.exception;

import com.example.giftgroupservice.entity.MembershipAction;
import com.example.giftgroupservice.entity.MembershipState;
import org.springframework.http.HttpStatus;

/**
 * Structurally disallowed membership transition (HTTP 422).
 */
public class InvalidOperationException extends BaseException {

    public InvalidOperationException(String code, String message) {
        super(code, message, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    public static InvalidOperationException leaderCannot(MembershipAction action) {
        if (action == MembershipAction.LEAVE) {
            return new InvalidOperationException("LEADER_CANNOT_LEAVE",
                "The leader cannot leave the group; delete the group instead");
        }
        return new InvalidOperationException("LEADER_MEMBERSHIP_IMMUTABLE",
            String.format("Action %s cannot be applied to the group leader", action));
    }

    public static InvalidOperationException illegalTransition(MembershipState from, MembershipAction action) {
        return new InvalidOperationException("ILLEGAL_MEMBERSHIP_TRANSITION",
            String.format("Action %s is not allowed from state %s", action, from));
    }

    public static InvalidOperationException noMembership(MembershipAction action) {
        return new InvalidOperationException("ILLEGAL_MEMBERSHIP_TRANSITION",
            String.format("Action %s requires an existing membership", action));
    }
}
