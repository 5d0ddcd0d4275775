package com.speedwatch.isa.service;

import com.speedwatch.isa.engine.ViolationCodeCatalog;
import com.speedwatch.isa.engine.ViolationRecordMapper;
import com.speedwatch.isa.engine.ViolationStore;
import com.speedwatch.isa.model.DeduplicationReport;
import com.speedwatch.isa.model.Disposition;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.SeverityTier;
import com.speedwatch.isa.model.SourceType;
import com.speedwatch.isa.model.ViolationRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

import static com.speedwatch.isa.engine.ViolationFixtures.REF;
import static com.speedwatch.isa.engine.ViolationFixtures.driver;
import static com.speedwatch.isa.engine.ViolationFixtures.vehicle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ViolationHistoryLoaderTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final ViolationStore store = new ViolationStore(new ViolationRecordMapper(ViolationCodeCatalog.defaults()));
    private final ViolationHistoryLoader loader = new ViolationHistoryLoader(jdbcTemplate, store);

    @Test
    @DisplayName("should map an archived row back to a violation record")
    void rowMapper() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("record_id")).thenReturn("S-1");
        when(rs.getString("entity_key")).thenReturn("AB123");
        when(rs.getString("entity_kind")).thenReturn("DRIVER");
        when(rs.getString("source_type")).thenReturn("OFFICER");
        when(rs.getString("violation_code")).thenReturn("1180C");
        when(rs.getInt("points")).thenReturn(5);
        when(rs.getString("severity")).thenReturn("HIGH");
        when(rs.getString("disposition")).thenReturn("SUSTAINED");
        when(rs.getTimestamp("occurred_at")).thenReturn(Timestamp.valueOf(LocalDateTime.of(2024, 3, 5, 22, 15)));
        when(rs.getString("jurisdiction")).thenReturn("NYPD");
        when(rs.getLong("ingest_sequence")).thenReturn(77L);

        ViolationRecord r = ViolationHistoryLoader.ROW_MAPPER.mapRow(rs, 0);

        assertThat(r.getEntityKind()).isEqualTo(EntityKind.DRIVER);
        assertThat(r.getSourceType()).isEqualTo(SourceType.OFFICER);
        assertThat(r.getSeverity()).isEqualTo(SeverityTier.HIGH);
        assertThat(r.getDisposition()).isEqualTo(Disposition.SUSTAINED);
        assertThat(r.getOccurredAt()).isEqualTo(LocalDateTime.of(2024, 3, 5, 22, 15));
        assertThat(r.getPoints()).isEqualTo(5);
        assertThat(r.getSequence()).isEqualTo(77L);
        assertThat(r.dedupKey()).isEqualTo("ID|S-1");
    }

    @Test
    @DisplayName("should restore the archive into the store and skip what it already holds")
    @SuppressWarnings("unchecked")
    void restore() {
        ViolationRecord known = driver("S-1", "D1", 2, REF);
        store.restore(List.of(known));
        when(jdbcTemplate.query(eq(ViolationHistoryLoader.HISTORY_QUERY), any(RowMapper.class)))
                .thenReturn(List.of(known, driver("S-2", "D1", 3, REF.minusDays(1)), vehicle("C-1", "ABC1:NY", REF)));

        DeduplicationReport report = loader.restoreIntoStore();

        assertThat(report.getAccepted()).isEqualTo(2);
        assertThat(report.getDuplicates()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(3);
        assertThat(store.snapshot(EntityKind.VEHICLE)).hasSize(1);
    }
}
