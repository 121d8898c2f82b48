package com.example.giftgroupservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything a member sees on a group page.
 * itemsByList is keyed by list id and already filtered for the viewer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupViewResponse {

    private GroupResponse group;
    private List<GiftListResponse> visibleLists;
    private Map<Long, List<ItemResponse>> itemsByList;
    private List<MemberResponse> members;
    private Set<Long> claimedItemIds;
    private Set<Long> myClaimedItemIds;
}
