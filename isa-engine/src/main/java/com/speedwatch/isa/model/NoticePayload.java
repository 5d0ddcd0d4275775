package com.speedwatch.isa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * JSON body posted to the notice delivery service.
 */
public record NoticePayload(
        @JsonProperty("alert_id") long alertId,
        @JsonProperty("entity_kind") EntityKind entityKind,
        @JsonProperty("entity_key") String entityKey,
        @JsonProperty("status") AlertStatus status,
        @JsonProperty("due_date") LocalDateTime dueDate,
        @JsonProperty("risk_score") double riskScore,
        @JsonProperty("reason") String reason) {

    public static NoticePayload from(EnforcementAlert alert) {
        return new NoticePayload(
                alert.getAlertId(),
                alert.getEntityKind(),
                alert.getEntityKey(),
                alert.getStatus(),
                alert.getDueDate(),
                alert.getRiskScoreAtCreation(),
                alert.getReason());
    }
}
