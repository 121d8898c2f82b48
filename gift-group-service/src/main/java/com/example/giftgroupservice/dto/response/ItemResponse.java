package com.example.giftgroupservice.dto.response;

import com.example.giftgroupservice.entity.Item;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an item that already passed visibility filtering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemResponse {

    private Long id;
    private Long listId;
    private String name;
    private String url;
    private String notes;
    private Long addedById;
    private boolean highPriority;

    /**
     * True when the owner removed the item; shown to others with a marker.
     */
    private boolean ownerHidden;

    /**
     * True for items added by a third party inside one group.
     */
    private boolean surprise;

    public static ItemResponse from(Item item) {
        return ItemResponse.builder()
                .id(item.getId())
                .listId(item.getListId())
                .name(item.getName())
                .url(item.getUrl())
                .notes(item.getNotes())
                .addedById(item.getAddedById())
                .highPriority(item.isHighPriority())
                .ownerHidden(item.isOwnerHidden())
                .surprise(item.isSurprise())
                .build();
    }
}
