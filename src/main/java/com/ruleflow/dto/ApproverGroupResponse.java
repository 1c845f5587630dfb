package com.ruleflow.dto;

import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ApproverGroupResponse {
    private UUID id;
    private String name;
    private String description;
    private List<String> memberIds;
    private long rotationCursor;
    private Instant createdAt;
    private Instant updatedAt;
}
