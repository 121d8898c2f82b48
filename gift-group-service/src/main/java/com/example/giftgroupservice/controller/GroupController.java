package com.example.giftgroupservice.controller;

import com.example.giftgroupservice.dto.request.CreateGroupRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.GroupManageResponse;
import com.example.giftgroupservice.dto.response.GroupResponse;
import com.example.giftgroupservice.dto.response.GroupViewResponse;
import com.example.giftgroupservice.dto.response.MyGroupResponse;
import com.example.giftgroupservice.security.CurrentUser;
import com.example.giftgroupservice.service.GroupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for group operations.
 *
 * Authorization:
 * - POST /api/groups: any registered user (becomes leader)
 * - GET /api/groups/{groupId}: approved members and leader
 * - GET /api/groups/{groupId}/manage, DELETE /api/groups/{groupId}: leader only
 */
@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;

    @PostMapping
    public ResponseEntity<GroupResponse> createGroup(
            @Valid @RequestBody CreateGroupRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        GroupResponse response = groupService.createGroup(currentUser.getUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Groups the caller has any membership in.
     */
    @GetMapping
    public ResponseEntity<List<MyGroupResponse>> getMyGroups(@AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(groupService.getMyGroups(currentUser.getUserId()));
    }

    @GetMapping("/search")
    public ResponseEntity<List<GroupResponse>> searchGroups(@RequestParam("q") String query) {
        return ResponseEntity.ok(groupService.searchGroups(query));
    }

    @GetMapping("/{groupId}")
    public ResponseEntity<GroupViewResponse> getGroupView(
            @PathVariable Long groupId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(groupService.getGroupView(groupId, currentUser.getUserId()));
    }

    @GetMapping("/{groupId}/manage")
    public ResponseEntity<GroupManageResponse> getManageView(
            @PathVariable Long groupId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(groupService.getManageView(groupId, currentUser.getUserId()));
    }

    @DeleteMapping("/{groupId}")
    public ResponseEntity<CascadeReport> deleteGroup(
            @PathVariable Long groupId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(groupService.deleteGroup(groupId, currentUser.getUserId()));
    }
}
