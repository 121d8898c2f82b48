package com.example.giftgroupservice.controller;

import com.example.giftgroupservice.dto.response.ClaimResponse;
import com.example.giftgroupservice.dto.response.ClaimResultResponse;
import com.example.giftgroupservice.security.CurrentUser;
import com.example.giftgroupservice.service.ClaimService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for claims.
 */
@RestController
@RequiredArgsConstructor
public class ClaimController {

    private final ClaimService claimService;

    @PostMapping("/api/groups/{groupId}/items/{itemId}/claim")
    public ResponseEntity<ClaimResultResponse> claim(
            @PathVariable Long groupId,
            @PathVariable Long itemId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ClaimResultResponse response = claimService.claim(groupId, itemId, currentUser.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/api/groups/{groupId}/items/{itemId}/unclaim")
    public ResponseEntity<ClaimResultResponse> unclaim(
            @PathVariable Long groupId,
            @PathVariable Long itemId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(claimService.unclaim(groupId, itemId, currentUser.getUserId()));
    }

    /**
     * Everything the caller has claimed, across all groups.
     */
    @GetMapping("/api/claims/mine")
    public ResponseEntity<List<ClaimResponse>> myClaims(@AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(claimService.myClaims(currentUser.getUserId()));
    }
}
