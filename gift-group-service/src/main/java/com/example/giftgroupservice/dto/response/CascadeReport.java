package com.example.giftgroupservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ids of every row deleted by a cascade, grouped by entity type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CascadeReport {

    @Builder.Default
    private List<Long> memberships = new ArrayList<>();

    @Builder.Default
    private List<Long> listGroups = new ArrayList<>();

    @Builder.Default
    private List<Long> claims = new ArrayList<>();

    @Builder.Default
    private List<Long> items = new ArrayList<>();

    @Builder.Default
    private List<Long> lists = new ArrayList<>();

    @Builder.Default
    private List<Long> groups = new ArrayList<>();

    @Builder.Default
    private List<Long> users = new ArrayList<>();

    public static CascadeReport empty() {
        return new CascadeReport();
    }

    /**
     * Append another report's rows to this one.
     */
    public CascadeReport merge(CascadeReport other) {
        memberships.addAll(other.memberships);
        listGroups.addAll(other.listGroups);
        claims.addAll(other.claims);
        items.addAll(other.items);
        lists.addAll(other.lists);
        groups.addAll(other.groups);
        users.addAll(other.users);
        return this;
    }

    public int totalRows() {
        return memberships.size() + listGroups.size() + claims.size() + items.size()
                + lists.size() + groups.size() + users.size();
    }
}
