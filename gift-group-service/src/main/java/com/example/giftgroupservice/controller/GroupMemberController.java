package com.example.giftgroupservice.controller;

import com.example.giftgroupservice.dto.request.AcceptInviteRequest;
import com.example.giftgroupservice.dto.request.InviteMemberRequest;
import com.example.giftgroupservice.dto.request.JoinGroupRequest;
import com.example.giftgroupservice.dto.response.MembershipResponse;
import com.example.giftgroupservice.security.CurrentUser;
import com.example.giftgroupservice.service.MembershipService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for membership transitions.
 *
 * Authorization:
 * - invitations, approve, deny, kick: group leader only
 * - join, accept, decline, leave, remove denied: the acting user on their own row
 */
@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
@Slf4j
public class GroupMemberController {

    private final MembershipService membershipService;

    /**
     * Ask to join a group given by id or name.
     */
    @PostMapping("/join")
    public ResponseEntity<MembershipResponse> requestToJoin(
            @Valid @RequestBody JoinGroupRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.joinByIdentifier(
                request.getGroupIdentifier(), currentUser.getUserId(), request.getSelectedListId()));
    }

    @PostMapping("/{groupId}/invitations")
    public ResponseEntity<MembershipResponse> invite(
            @PathVariable Long groupId,
            @Valid @RequestBody InviteMemberRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.invite(groupId, currentUser.getUserId(), request.getIdentifier()));
    }

    @PostMapping("/{groupId}/invitation/accept")
    public ResponseEntity<MembershipResponse> accept(
            @PathVariable Long groupId,
            @Valid @RequestBody AcceptInviteRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.accept(groupId, currentUser.getUserId(), request.getSelectedListId()));
    }

    @PostMapping("/{groupId}/invitation/decline")
    public ResponseEntity<MembershipResponse> decline(
            @PathVariable Long groupId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.decline(groupId, currentUser.getUserId()));
    }

    @PostMapping("/{groupId}/members/{userId}/approve")
    public ResponseEntity<MembershipResponse> approve(
            @PathVariable Long groupId,
            @PathVariable Long userId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.approve(groupId, currentUser.getUserId(), userId));
    }

    @PostMapping("/{groupId}/members/{userId}/deny")
    public ResponseEntity<MembershipResponse> deny(
            @PathVariable Long groupId,
            @PathVariable Long userId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.deny(groupId, currentUser.getUserId(), userId));
    }

    /**
     * Kick a member (or cancel an invite / request).
     */
    @DeleteMapping("/{groupId}/members/{userId}")
    public ResponseEntity<MembershipResponse> kick(
            @PathVariable Long groupId,
            @PathVariable Long userId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.kick(groupId, currentUser.getUserId(), userId));
    }

    @PostMapping("/{groupId}/leave")
    public ResponseEntity<MembershipResponse> leave(
            @PathVariable Long groupId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.leave(groupId, currentUser.getUserId()));
    }

    /**
     * Remove the caller's own denied membership.
     */
    @DeleteMapping("/{groupId}/membership")
    public ResponseEntity<MembershipResponse> removeDenied(
            @PathVariable Long groupId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(membershipService.removeDenied(groupId, currentUser.getUserId()));
    }
}
