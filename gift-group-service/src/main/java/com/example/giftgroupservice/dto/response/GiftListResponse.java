package com.example.giftgroupservice.dto.response;

import com.example.giftgroupservice.entity.GiftList;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a gift list. Items are only present on single-list views.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GiftListResponse {

    private Long id;
    private Long ownerId;
    private String name;
    private Instant createdAt;
    private Boolean owner;
    private List<ItemResponse> items;

    public static GiftListResponse from(GiftList list) {
        return GiftListResponse.builder()
                .id(list.getId())
                .ownerId(list.getOwnerId())
                .name(list.getName())
                .createdAt(list.getCreatedAt())
                .build();
    }

    public static GiftListResponse from(GiftList list, Long viewerId, List<ItemResponse> items) {
        GiftListResponse response = from(list);
        response.setOwner(list.isOwnedBy(viewerId));
        response.setItems(items);
        return response;
    }
}
