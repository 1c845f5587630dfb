package com.ruleflow.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CancelRequest {
    private String reason;
    private Long expectedVersion;
}
