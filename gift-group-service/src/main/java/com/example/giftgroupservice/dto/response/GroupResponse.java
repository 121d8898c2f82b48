package com.example.giftgroupservice.dto.response;

import com.example.giftgroupservice.entity.Group;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupResponse {

    private Long id;
    private String name;
    private Long leaderId;
    private Instant createdAt;

    public static GroupResponse from(Group group) {
        return GroupResponse.builder()
                .id(group.getId())
                .name(group.getName())
                .leaderId(group.getLeaderId())
                .createdAt(group.getCreatedAt())
                .build();
    }
}
