package com.example.giftgroupservice.service;

import com.example.giftgroupservice.dto.request.RegisterUserRequest;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.dto.response.DashboardResponse;
import com.example.giftgroupservice.dto.response.UserResponse;

/**
 * Service interface for local user profiles.
 */
public interface UserService {

    /**
     * Register the caller's profile (handle and contact address).
     * Both must be unused; an identity can register only once.
     *
     * @param userId user id from the access token
     */
    UserResponse register(Long userId, RegisterUserRequest request);

    /**
     * @throws com.example.giftgroupservice.exception.UnauthorizedException if no profile exists
     */
    UserResponse getProfile(Long userId);

    /**
     * Lists, groups, groups per list and every claim of the user.
     */
    DashboardResponse getDashboard(Long userId);

    /**
     * Account-deletion cascade. Safe to repeat: an unknown user yields an empty report.
     */
    CascadeReport deleteAccount(Long userId);
}
