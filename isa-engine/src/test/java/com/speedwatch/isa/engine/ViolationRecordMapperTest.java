package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.Disposition;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.RawViolationRow;
import com.speedwatch.isa.model.SeverityTier;
import com.speedwatch.isa.model.SourceType;
import com.speedwatch.isa.model.ViolationRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static com.speedwatch.isa.engine.ViolationFixtures.cameraRow;
import static com.speedwatch.isa.engine.ViolationFixtures.officerRow;
import static org.assertj.core.api.Assertions.assertThat;

class ViolationRecordMapperTest {

    private final ViolationRecordMapper mapper = new ViolationRecordMapper(ViolationCodeCatalog.defaults());

    @Nested
    @DisplayName("Accepted rows")
    class Accepted {

        @Test
        @DisplayName("should key officer rows by upper-cased license and resolve points from the code")
        void mapsOfficerRow() {
            ViolationRecordMapper.Result result = mapper.map(
                    ViolationFixtures.officerRow(" s-100 ", "ab123456", "1180 d", "2024-03-05T22:15:00"),
                    SourceType.OFFICER, 7);

            assertThat(result.isAccepted()).isTrue();
            ViolationRecord r = result.record();
            assertThat(r.getRecordId()).isEqualTo("s-100");
            assertThat(r.getEntityKey()).isEqualTo("AB123456");
            assertThat(r.getEntityKind()).isEqualTo(EntityKind.DRIVER);
            assertThat(r.getViolationCode()).isEqualTo("1180D");
            assertThat(r.getPoints()).isEqualTo(8);
            assertThat(r.getSeverity()).isEqualTo(SeverityTier.SEVERE);
            assertThat(r.getDisposition()).isEqualTo(Disposition.SUSTAINED);
            assertThat(r.getJurisdiction()).isEqualTo("NYPD");
            assertThat(r.getOccurredAt()).isEqualTo(LocalDateTime.of(2024, 3, 5, 22, 15));
            assertThat(r.getSequence()).isEqualTo(7);
        }

        @Test
        @DisplayName("should key camera rows by PLATE:STATE with spaces removed")
        void cameraRowKey() {
            ViolationRecordMapper.Result result = mapper.map(
                    cameraRow("C-1", "abc 1234", "ny", "2024-03-05 08:00"), SourceType.CAMERA, 1);

            assertThat(result.record().getEntityKey()).isEqualTo("ABC1234:NY");
            assertThat(result.record().getEntityKind()).isEqualTo(EntityKind.VEHICLE);
            assertThat(result.record().getPoints()).isZero();
        }

        @Test
        @DisplayName("should prefer the row's own source type over the default")
        void rowSourceWins() {
            RawViolationRow row = cameraRow("C-2", "XYZ9", "NJ", "2024-03-05");
            row.setSourceType("SPEED_CAMERA");

            ViolationRecordMapper.Result result = mapper.map(row, SourceType.OFFICER, 1);

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.record().getSourceType()).isEqualTo(SourceType.CAMERA);
        }

        @Test
        @DisplayName("should treat unknown dispositions as pending rather than reject")
        void pendingDisposition() {
            RawViolationRow row = officerRow("S-2", "D1", "1180A", "2024-03-05");
            row.setDisposition("SCHEDULED");

            assertThat(mapper.map(row, SourceType.OFFICER, 1).record().getDisposition())
                    .isEqualTo(Disposition.PENDING);
        }
    }

    @Nested
    @DisplayName("Rejected rows")
    class Rejected {

        @Test
        @DisplayName("should reject a missing license and echo row number and record id")
        void missingLicense() {
            RawViolationRow row = officerRow("S-9", null, "1180A", "2024-03-05");
            row.setRowNumber(4);

            ViolationRecordMapper.Result result = mapper.map(row, SourceType.OFFICER, 1);

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.rejection().rowNumber()).isEqualTo(4);
            assertThat(result.rejection().recordId()).isEqualTo("S-9");
            assertThat(result.rejection().reason()).isEqualTo("missing license number");
        }

        @Test
        @DisplayName("should treat the literal string null as missing")
        void literalNull() {
            ViolationRecordMapper.Result result = mapper.map(
                    officerRow("S-9", "null", "1180A", "2024-03-05"), SourceType.OFFICER, 1);

            assertThat(result.rejection().reason()).isEqualTo("missing license number");
        }

        @Test
        @DisplayName("should reject a camera row without plate state")
        void missingPlateState() {
            ViolationRecordMapper.Result result = mapper.map(
                    cameraRow("C-3", "ABC1", " ", "2024-03-05"), SourceType.CAMERA, 1);

            assertThat(result.rejection().reason()).isEqualTo("missing plate state");
        }

        @Test
        @DisplayName("should reject codes outside the catalog")
        void unknownCode() {
            ViolationRecordMapper.Result result = mapper.map(
                    officerRow("S-3", "D1", "1192", "2024-03-05"), SourceType.OFFICER, 1);

            assertThat(result.rejection().reason()).isEqualTo("unknown violation code '1192'");
        }

        @Test
        @DisplayName("should reject unparseable timestamps")
        void badTimestamp() {
            ViolationRecordMapper.Result result = mapper.map(
                    officerRow("S-4", "D1", "1180A", "yesterday"), SourceType.OFFICER, 1);

            assertThat(result.rejection().reason()).isEqualTo("unparseable timestamp 'yesterday'");
        }

        @Test
        @DisplayName("should reject rows whose source is neither named nor defaulted")
        void noSource() {
            assertThat(mapper.map(officerRow("S-5", "D1", "1180A", "2024-03-05"), null, 1)
                    .rejection().reason()).isEqualTo("missing source type");

            RawViolationRow row = officerRow("S-6", "D1", "1180A", "2024-03-05");
            row.setSourceType("drone");
            assertThat(mapper.map(row, SourceType.OFFICER, 1).rejection().reason())
                    .isEqualTo("unknown source type 'drone'");
        }
    }

    @ParameterizedTest(name = "{0}")
    @DisplayName("should accept the timestamp forms used by court and camera feeds")
    @CsvSource({
            "2024-03-05T22:15:00,        2024-03-05T22:15",
            "2024-03-05T22:15,           2024-03-05T22:15",
            "2024-03-05 22:15:30,        2024-03-05T22:15:30",
            "03/05/2024 22:15,           2024-03-05T22:15",
            "2024-03-05,                 2024-03-05T00:00",
            "03/05/2024,                 2024-03-05T00:00",
            "2024-03-05T22:15:00-05:00,  2024-03-05T22:15"
    })
    void timestampForms(String raw, String expected) {
        assertThat(ViolationRecordMapper.parseTimestamp(raw)).contains(LocalDateTime.parse(expected));
    }
}
