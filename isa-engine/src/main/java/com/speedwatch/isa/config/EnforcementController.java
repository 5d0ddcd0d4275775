package com.speedwatch.isa.config;

import com.speedwatch.isa.enforcement.EnforcementLifecycle;
import com.speedwatch.isa.exception.AlertConflictException;
import com.speedwatch.isa.exception.AlertNotFoundException;
import com.speedwatch.isa.exception.IllegalAlertTransitionException;
import com.speedwatch.isa.exception.MissingIdentifierColumnException;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.model.RawViolationRow;
import com.speedwatch.isa.model.SourceType;
import com.speedwatch.isa.model.Tier;
import com.speedwatch.isa.output.CsvWriter;
import com.speedwatch.isa.service.DetectionService;
import com.speedwatch.isa.service.ViolationCsvParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST adapter over the detection service and the enforcement lifecycle.
 * Holds no logic of its own: it parses parameters, calls through and maps failures
 * to status codes.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class EnforcementController {

    private final DetectionService detectionService;
    private final EnforcementLifecycle lifecycle;
    private final ViolationCsvParser csvParser;
    private final CsvWriter csvWriter;
    private final Clock clock;

    // ── Ingestion ─────────────────────────────────────────────────────────────

    /**
     * Upload a court or camera CSV export.
     *
     * POST /violations/upload?source=CAMERA  (multipart "file")
     */
    @PostMapping("/violations/upload")
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file,
                                    @RequestParam(required = false) String source) {
        return handle("CSV upload", () -> {
            SourceType sourceType = parseSource(source);
            try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
                List<RawViolationRow> rows = csvParser.parse(reader, sourceType);
                return ResponseEntity.ok(detectionService.ingest(rows, sourceType));
            }
        });
    }

    /**
     * POST /violations?source=OFFICER  with a JSON array of rows
     */
    @PostMapping("/violations")
    public ResponseEntity<?> ingest(@RequestBody List<RawViolationRow> rows,
                                    @RequestParam(required = false) String source) {
        return handle("JSON ingest", () ->
                ResponseEntity.ok(detectionService.ingest(rows, parseSource(source))));
    }

    // ── Detection ─────────────────────────────────────────────────────────────

    /**
     * Ingest a batch and open notices for the entities it pushed over the threshold.
     *
     * POST /detection/driver/new-crossings?source=OFFICER  with a JSON array of rows
     */
    @PostMapping("/detection/{kind}/new-crossings")
    public ResponseEntity<?> newCrossings(@PathVariable String kind,
                                          @RequestBody List<RawViolationRow> rows,
                                          @RequestParam(required = false) String source) {
        return handle("Detection run", () -> ResponseEntity.ok(
                detectionService.detectNewCrossings(EntityKind.parse(kind), rows, parseSource(source))));
    }

    @PostMapping("/detection/{kind}/new-crossings/upload")
    public ResponseEntity<?> newCrossingsUpload(@PathVariable String kind,
                                                @RequestParam("file") MultipartFile file,
                                                @RequestParam(required = false) String source) {
        return handle("Detection run", () -> {
            EntityKind entityKind = EntityKind.parse(kind);
            SourceType sourceType = parseSource(source);
            try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
                List<RawViolationRow> rows = csvParser.parse(reader, sourceType);
                return ResponseEntity.ok(detectionService.detectNewCrossings(entityKind, rows, sourceType));
            }
        });
    }

    /**
     * Open NEW alerts for REQUIRED entities that never had one, e.g. after a plain ingest.
     *
     * POST /detection/vehicle/reconcile
     */
    @PostMapping("/detection/{kind}/reconcile")
    public ResponseEntity<?> reconcile(@PathVariable String kind,
                                       @RequestParam(required = false)
                                       @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Reconcile", () ->
                ResponseEntity.ok(detectionService.reconcile(EntityKind.parse(kind), asOf)));
    }

    // ── Roster ────────────────────────────────────────────────────────────────

    /**
     * GET /roster/driver?asOf=2024-06-30T23:59:59
     *
     * Without asOf the window ends at the latest stored violation.
     */
    @GetMapping("/roster/{kind}")
    public ResponseEntity<?> roster(@PathVariable String kind,
                                    @RequestParam(required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Roster", () ->
                ResponseEntity.ok(detectionService.buildRoster(EntityKind.parse(kind), asOf)));
    }

    @GetMapping("/roster/{kind}/summary")
    public ResponseEntity<?> summary(@PathVariable String kind,
                                     @RequestParam(required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Summary", () ->
                ResponseEntity.ok(detectionService.summarize(EntityKind.parse(kind), asOf)));
    }

    @GetMapping("/roster/{kind}/jurisdictions")
    public ResponseEntity<?> jurisdictions(@PathVariable String kind,
                                           @RequestParam(required = false)
                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Jurisdiction stats", () ->
                ResponseEntity.ok(detectionService.jurisdictionStats(EntityKind.parse(kind), asOf)));
    }

    @GetMapping("/roster/{kind}/cross-jurisdiction")
    public ResponseEntity<?> crossJurisdiction(@PathVariable String kind,
                                               @RequestParam(required = false)
                                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Cross-jurisdiction offenders", () ->
                ResponseEntity.ok(detectionService.crossJurisdictionOffenders(EntityKind.parse(kind), asOf)));
    }

    @GetMapping("/roster/{kind}/impact")
    public ResponseEntity<?> impact(@PathVariable String kind,
                                    @RequestParam(required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Impact metrics", () ->
                ResponseEntity.ok(detectionService.impactMetrics(EntityKind.parse(kind), asOf)));
    }

    @GetMapping("/roster/{kind}/entities/{entityKey}")
    public ResponseEntity<?> entity(@PathVariable String kind,
                                    @PathVariable String entityKey,
                                    @RequestParam(required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Entity detail", () -> detectionService.entityDetail(EntityKind.parse(kind), entityKey, asOf)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "No counted violations for " + entityKey))));
    }

    // ── CSV exports ───────────────────────────────────────────────────────────

    @GetMapping("/export/{kind}/roster.csv")
    public ResponseEntity<?> exportRoster(@PathVariable String kind,
                                          @RequestParam(required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Roster export", () -> {
            StringWriter out = new StringWriter();
            csvWriter.writeRoster(out, detectionService.buildRoster(EntityKind.parse(kind), asOf));
            return csvResponse(out.toString(), "roster_" + kind.toLowerCase() + ".csv");
        });
    }

    /**
     * GET /export/driver/detail.csv?minimumTier=REQUIRED
     */
    @GetMapping("/export/{kind}/detail.csv")
    public ResponseEntity<?> exportDetail(@PathVariable String kind,
                                          @RequestParam(defaultValue = "REQUIRED") Tier minimumTier,
                                          @RequestParam(required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("Detail export", () -> {
            StringWriter out = new StringWriter();
            csvWriter.writeDetail(out, detectionService.details(EntityKind.parse(kind), asOf, minimumTier));
            return csvResponse(out.toString(), "detail_" + kind.toLowerCase() + ".csv");
        });
    }

    /**
     * Write the roster and detail exports to the output directory.
     *
     * POST /export/driver
     */
    @PostMapping("/export/{kind}")
    public ResponseEntity<?> exportFiles(@PathVariable String kind,
                                         @RequestParam(required = false)
                                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        return handle("File export", () -> {
            Map<String, String> written = new LinkedHashMap<>();
            detectionService.exportFiles(EntityKind.parse(kind), asOf)
                    .forEach((name, path) -> written.put(name, path.toString()));
            return ResponseEntity.ok(written);
        });
    }

    // ── Alerts ────────────────────────────────────────────────────────────────

    /**
     * GET /alerts?kind=DRIVER&status=NOTICE_SENT
     */
    @GetMapping("/alerts")
    public ResponseEntity<?> alerts(@RequestParam(required = false) String kind,
                                    @RequestParam(required = false) AlertStatus status) {
        return handle("Alert list", () -> {
            EntityKind entityKind = kind == null ? null : EntityKind.parse(kind);
            List<EnforcementAlert> alerts = lifecycle.roster().stream()
                    .filter(a -> entityKind == null || a.getEntityKind() == entityKind)
                    .filter(a -> status == null || a.getStatus() == status)
                    .sorted(Comparator.comparing(EnforcementAlert::getAlertId))
                    .toList();
            return ResponseEntity.ok(alerts);
        });
    }

    @GetMapping("/alerts/{alertId}")
    public ResponseEntity<?> alert(@PathVariable long alertId) {
        return handle("Alert lookup", () -> ResponseEntity.ok(lifecycle.get(alertId)));
    }

    @PostMapping("/alerts/{alertId}/send")
    public ResponseEntity<?> send(@PathVariable long alertId,
                                  @RequestBody(required = false) Map<String, String> body) {
        return handle("Send notice", () -> ResponseEntity.ok(
                lifecycle.sendNotice(alertId, detectionService.policy(), actor(body), now())));
    }

    @PostMapping("/alerts/{alertId}/follow-up")
    public ResponseEntity<?> followUp(@PathVariable long alertId,
                                      @RequestBody(required = false) Map<String, String> body) {
        return handle("Follow-up", () -> ResponseEntity.ok(
                lifecycle.markFollowUpDue(alertId, detectionService.policy(), actor(body), notes(body), now())));
    }

    @PostMapping("/alerts/{alertId}/comply")
    public ResponseEntity<?> comply(@PathVariable long alertId,
                                    @RequestBody(required = false) Map<String, String> body) {
        return handle("Confirm installation", () -> ResponseEntity.ok(
                lifecycle.confirmInstallation(alertId, actor(body), notes(body), now())));
    }

    @PostMapping("/alerts/{alertId}/escalate")
    public ResponseEntity<?> escalate(@PathVariable long alertId,
                                      @RequestBody(required = false) Map<String, String> body) {
        return handle("Escalate", () -> ResponseEntity.ok(
                lifecycle.escalate(alertId, actor(body), notes(body), now())));
    }

    @PostMapping("/alerts/sweep")
    public ResponseEntity<?> sweep() {
        return handle("Overdue sweep", () -> ResponseEntity.ok(
                lifecycle.sweepOverdueNotices(detectionService.policy(), now())));
    }

    // ── Policy ────────────────────────────────────────────────────────────────

    @GetMapping("/policy")
    public ResponseEntity<PolicyConfiguration> policy() {
        return ResponseEntity.ok(detectionService.policy());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    @FunctionalInterface
    interface Call {
        ResponseEntity<?> run() throws Exception;
    }

    private ResponseEntity<?> handle(String operation, Call call) {
        try {
            return call.run();
        } catch (MissingIdentifierColumnException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e));
        } catch (AlertNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e));
        } catch (AlertConflictException | IllegalAlertTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(error(e));
        } catch (Exception e) {
            log.error("{} failed: {}", operation, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(error(e));
        }
    }

    private static Map<String, String> error(Exception e) {
        return Map.of("error", String.valueOf(e.getMessage()));
    }

    private static SourceType parseSource(String source) {
        if (source == null || source.isBlank()) return null;
        SourceType type = SourceType.fromFeedValue(source);
        if (type == null) {
            throw new IllegalArgumentException("Unknown source: " + source + " (expected CAMERA or OFFICER)");
        }
        return type;
    }

    private static String actor(Map<String, String> body) {
        return body == null ? null : body.get("actor");
    }

    private static String notes(Map<String, String> body) {
        return body == null ? null : body.get("notes");
    }

    private static ResponseEntity<String> csvResponse(String csv, String filename) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
