package com.example.giftgroupservice.controller;

import com.example.giftgroupservice.dto.request.AddItemRequest;
import com.example.giftgroupservice.dto.request.CreateListRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.GiftListResponse;
import com.example.giftgroupservice.dto.response.ItemResponse;
import com.example.giftgroupservice.security.CurrentUser;
import com.example.giftgroupservice.service.GiftListService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for gift lists and items.
 *
 * Authorization:
 * - list mutations: list owner only
 * - GET /api/lists/{listId}: owner, or approved member of a group showing the list
 * - surprise items: approved member of the group, never the list owner
 */
@RestController
@RequiredArgsConstructor
public class GiftListController {

    private final GiftListService giftListService;

    @PostMapping("/api/lists")
    public ResponseEntity<GiftListResponse> createList(
            @Valid @RequestBody CreateListRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        GiftListResponse response = giftListService.createList(currentUser.getUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/api/lists")
    public ResponseEntity<List<GiftListResponse>> getMyLists(@AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(giftListService.getMyLists(currentUser.getUserId()));
    }

    @GetMapping("/api/lists/{listId}")
    public ResponseEntity<GiftListResponse> getList(
            @PathVariable Long listId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(giftListService.getList(listId, currentUser.getUserId()));
    }

    @DeleteMapping("/api/lists/{listId}")
    public ResponseEntity<CascadeReport> deleteList(
            @PathVariable Long listId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(giftListService.deleteList(listId, currentUser.getUserId()));
    }

    @PostMapping("/api/lists/{listId}/items")
    public ResponseEntity<ItemResponse> addItem(
            @PathVariable Long listId,
            @Valid @RequestBody AddItemRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ItemResponse response = giftListService.addItem(listId, request, currentUser.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Owner removes an item from their own view. Other members still see it.
     */
    @PostMapping("/api/lists/{listId}/items/{itemId}/hide")
    public ResponseEntity<ItemResponse> hideItem(
            @PathVariable Long listId,
            @PathVariable Long itemId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(giftListService.hideItem(listId, itemId, currentUser.getUserId()));
    }

    @PostMapping("/api/groups/{groupId}/lists/{listId}/surprise-items")
    public ResponseEntity<ItemResponse> addSurpriseItem(
            @PathVariable Long groupId,
            @PathVariable Long listId,
            @Valid @RequestBody AddItemRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ItemResponse response = giftListService.addSurpriseItem(groupId, listId, request, currentUser.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
