package com.speedwatch.isa.config;

import com.speedwatch.isa.engine.ViolationCodeCatalog;
import com.speedwatch.isa.exception.PolicyConfigurationException;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.model.SeverityTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "isa-engine")
@Data
public class IsaEngineProperties {

    private Policy policy = new Policy();
    private Map<String, Code> codes = new LinkedHashMap<>();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();
    private Notice notice = new Notice();

    @Data
    public static class Policy {
        private int pointsThreshold = 11;
        private int ticketThreshold = 16;
        private int driverWindowMonths = 24;
        private int vehicleWindowMonths = 12;
        private Band warningBandPoints = new Band(8, 11);
        private Band warningBandTickets = new Band(14, 16);
        private double severityWeight = 0.6;
        private double nighttimeWeight = 0.3;
        private double crossJurisdictionWeight = 0.1;
        private double severityCap = 2.0;
        /** HH:mm, local time of the violation. */
        private String nightStart = "22:00";
        private String nightEnd = "04:00";
        private int noticePeriodDays = 14;
        private int followUpPeriodDays = 7;

        /**
         * Immutable, validated policy for the engine. Misconfiguration fails here,
         * at startup, rather than during a detection run.
         */
        public PolicyConfiguration toPolicyConfiguration() {
            List<String> problems = new ArrayList<>();
            LocalTime start = parseTime("night-start", nightStart, problems);
            LocalTime end = parseTime("night-end", nightEnd, problems);

            PolicyConfiguration config = PolicyConfiguration.builder()
                    .pointsThreshold(pointsThreshold)
                    .ticketThreshold(ticketThreshold)
                    .driverWindowMonths(driverWindowMonths)
                    .vehicleWindowMonths(vehicleWindowMonths)
                    .warningBandPoints(warningBandPoints.toBand())
                    .warningBandTickets(warningBandTickets.toBand())
                    .severityWeight(severityWeight)
                    .nighttimeWeight(nighttimeWeight)
                    .crossJurisdictionWeight(crossJurisdictionWeight)
                    .severityCap(severityCap)
                    .nightStart(start)
                    .nightEnd(end)
                    .noticePeriod(Duration.ofDays(noticePeriodDays))
                    .followUpPeriod(Duration.ofDays(followUpPeriodDays))
                    .build();

            problems.addAll(config.problems());
            if (!problems.isEmpty()) {
                throw new PolicyConfigurationException(problems);
            }
            return config;
        }

        private static LocalTime parseTime(String name, String value, List<String> problems) {
            if (value == null) {
                return null;
            }
            try {
                return LocalTime.parse(value.trim());
            } catch (DateTimeParseException e) {
                problems.add(name + " must be HH:mm, was '" + value + "'");
                return null;
            }
        }
    }

    @Data
    public static class Band {
        private int low;
        private int high;

        public Band() {
        }

        public Band(int low, int high) {
            this.low = low;
            this.high = high;
        }

        PolicyConfiguration.Band toBand() {
            return new PolicyConfiguration.Band(low, high);
        }
    }

    @Data
    public static class Code {
        private int points;
        private SeverityTier severity = SeverityTier.LOW;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CSV;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String followUpSweepCron = "0 0 6 * * ?";
        private boolean loadHistoryOnStartup = false;
    }

    @Data
    public static class Notice {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:8090";
    }

    /**
     * Catalog from the configured codes, or the built-in VTL 1180 catalog when none are configured.
     */
    public ViolationCodeCatalog toCodeCatalog() {
        if (codes.isEmpty()) {
            return ViolationCodeCatalog.defaults();
        }
        Map<String, ViolationCodeCatalog.CodeDefinition> defs = new LinkedHashMap<>();
        codes.forEach((code, c) -> defs.put(code,
                new ViolationCodeCatalog.CodeDefinition(code, c.getPoints(), c.getSeverity())));
        return new ViolationCodeCatalog(defs);
    }
}
