package com.ruleflow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;
import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private int status;
    private String error;
    private String message;
    // offset of a syntax error in the failing expression
    private Integer position;
    private Map<String, String> fieldErrors;
    @Builder.Default
    private Instant timestamp = Instant.now();
}
