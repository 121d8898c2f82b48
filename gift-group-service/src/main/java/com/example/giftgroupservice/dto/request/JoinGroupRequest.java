package com.example.giftgroupservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for asking to join a group.
 * groupIdentifier is either the numeric group id or the exact group name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JoinGroupRequest {

    @NotBlank(message = "Group identifier is required")
    private String groupIdentifier;

    @NotNull(message = "Selected list is required")
    private Long selectedListId;
}
