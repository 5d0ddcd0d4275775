package com.speedwatch.isa.output;

import com.speedwatch.isa.config.IsaEngineProperties;
import com.speedwatch.isa.enforcement.AlertAuditSink;
import com.speedwatch.isa.model.DetectionRun;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes archive writes to the configured sink(s).
 * Supports CLICKHOUSE, CSV, or BOTH modes. Alert history and run metadata only go to
 * ClickHouse. A failed archive write is logged and never fails the caller.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter implements AlertAuditSink {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final IsaEngineProperties properties;

    public void writeViolations(List<ViolationRecord> records, String label) {
        if (records.isEmpty()) return;
        IsaEngineProperties.Output.OutputMode mode = properties.getOutput().getMode();

        try {
            switch (mode) {
                case CLICKHOUSE -> clickHouseWriter.write(records);
                case CSV -> csvWriter.writeViolations(records, label);
                case BOTH -> {
                    clickHouseWriter.write(records);
                    csvWriter.writeViolations(records, label);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to archive {} violations ({}): {}", records.size(), mode, e.getMessage());
        }
    }

    @Override
    public void record(EnforcementAlert alert) {
        if (!writesToClickHouse()) return;
        try {
            clickHouseWriter.writeAlert(alert);
        } catch (Exception e) {
            log.warn("Failed to archive alert {} ({}): {}", alert.getAlertId(), alert.getStatus(), e.getMessage());
        }
    }

    public void writeDetectionRun(DetectionRun run) {
        if (!writesToClickHouse()) return;
        try {
            clickHouseWriter.writeDetectionRun(run);
        } catch (Exception e) {
            log.warn("Failed to write detection run metadata: {}", e.getMessage());
        }
    }

    public boolean writesToClickHouse() {
        return properties.getOutput().getMode() != IsaEngineProperties.Output.OutputMode.CSV;
    }
}
