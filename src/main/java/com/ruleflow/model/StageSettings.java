package com.ruleflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/**
 * Per-step presentation and notification settings.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StageSettings {

    private List<String> visibleFields;
    private EmailNotifications emailNotifications;

    public boolean notifiesOnEntry() {
        return emailNotifications != null && emailNotifications.isEnabled();
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmailNotifications {
        private boolean enabled;
        private List<String> recipients;
        // days after step entry
        private List<Integer> reminders;
    }
}
