package com.example.giftgroupservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding an item to a list.
 * Used both by the owner and, without highPriority, for surprise items.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddItemRequest {

    @NotBlank(message = "Item name is required")
    @Size(max = 200, message = "Item name must not exceed 200 characters")
    private String name;

    @Size(max = 2000, message = "URL must not exceed 2000 characters")
    private String url;

    @Size(max = 2000, message = "Notes must not exceed 2000 characters")
    private String notes;

    /**
     * "I really want this". Ignored for surprise items.
     */
    private boolean highPriority;
}
