package com.example.giftgroupservice.controller;

import com.example.giftgroupservice.dto.request.RegisterUserRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.DashboardResponse;
import com.example.giftgroupservice.dto.response.UserResponse;
import com.example.giftgroupservice.security.CurrentUser;
import com.example.giftgroupservice.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for the caller's own account.
 */
@RestController
@RequestMapping("/api/users/me")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    /**
     * Register the profile for the identity in the token.
     */
    @PostMapping
    public ResponseEntity<UserResponse> register(
            @Valid @RequestBody RegisterUserRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        UserResponse response = userService.register(currentUser.getUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<UserResponse> getProfile(@AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(userService.getProfile(currentUser.getUserId()));
    }

    /**
     * Lists, groups and the gifts the caller is giving.
     */
    @GetMapping("/dashboard")
    public ResponseEntity<DashboardResponse> getDashboard(@AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(userService.getDashboard(currentUser.getUserId()));
    }

    /**
     * Delete the account and everything that depends on it.
     */
    @DeleteMapping
    public ResponseEntity<CascadeReport> deleteAccount(@AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(userService.deleteAccount(currentUser.getUserId()));
    }
}
