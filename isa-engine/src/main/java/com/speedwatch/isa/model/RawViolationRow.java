package com.speedwatch.isa.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unvalidated violation row as it arrives from an upload or a prior system.
 * Kept separate from {@link ViolationRecord} so feed quirks stay out of the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawViolationRow {

    /** 1-based position in the batch, used in rejection reports. */
    @JsonIgnore
    private int rowNumber;

    @JsonProperty("record_id")
    @JsonAlias({"summons_number", "ticket_number"})
    private String recordId;

    @JsonProperty("source_type")
    private String sourceType;

    @JsonProperty("license_number")
    @JsonAlias({"driver_license_number", "license_id"})
    private String licenseNumber;

    @JsonProperty("plate_id")
    @JsonAlias("plate")
    private String plateId;

    @JsonProperty("plate_state")
    @JsonAlias({"state", "registration_state"})
    private String plateState;

    @JsonProperty("violation_code")
    @JsonAlias("violation")
    private String violationCode;

    @JsonProperty("occurred_at")
    @JsonAlias({"date_of_violation", "issue_date", "violation_date"})
    private String occurredAt;

    private String disposition;

    @JsonAlias({"police_agency", "county", "issuing_agency"})
    private String jurisdiction;
}
