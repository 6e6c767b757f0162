package sp.sistemaspalacios.api_attendance.service.mirror;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationOutcome;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationResult;
import sp.sistemaspalacios.api_attendance.dto.event.CanonicalTapEvent;
import sp.sistemaspalacios.api_attendance.dto.event.MirrorEntry;
import sp.sistemaspalacios.api_attendance.dto.mirror.MirrorSyncRequest;
import sp.sistemaspalacios.api_attendance.dto.mirror.MirrorSyncResult;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.TapAction;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.RejectionReason;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;
import sp.sistemaspalacios.api_attendance.service.employeeAttendance.AttendanceEventNormalizer;
import sp.sistemaspalacios.api_attendance.service.employeeAttendance.AttendanceReconciliationEngine;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MirrorSyncAdapter Tests")
class MirrorSyncAdapterTest {

    private static final String TAG = "04A2B3C4";

    @Mock
    private AttendanceReconciliationEngine engine;

    @Mock
    private MirrorSnapshotClient snapshotClient;

    private MirrorSyncAdapter adapter;

    @BeforeEach
    void setUp() {
        AttendanceProperties properties = new AttendanceProperties();
        properties.setZoneId(ZoneOffset.UTC);
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T20:00:00Z"), ZoneOffset.UTC);
        AttendanceEventNormalizer normalizer = new AttendanceEventNormalizer(
                new TimeService(properties, clock), new ObjectMapper());
        adapter = new MirrorSyncAdapter(normalizer, engine, snapshotClient);
    }

    private static ReconciliationResult result(ReconciliationOutcome outcome) {
        return ReconciliationResult.builder().outcome(outcome).build();
    }

    @Test
    @DisplayName("Should count a new day with check-in and check-out as created")
    void shouldCountCreated() {
        when(engine.reconcile(any(CanonicalTapEvent.class)))
                .thenReturn(result(ReconciliationOutcome.CREATED), result(ReconciliationOutcome.UPDATED));

        MirrorSyncResult result = adapter.onEvent(TAG, Map.of("2025-03-10", new MirrorEntry("08:02:00", "17:31:45")));

        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getUpdated()).isZero();
        assertThat(result.getProcessed()).isEqualTo(1);
        verify(engine).reconcile(argThat(e -> e.getAction() == TapAction.OPEN));
        verify(engine).reconcile(argThat(e -> e.getAction() == TapAction.CLOSE));
    }

    @Test
    @DisplayName("Should count a redelivered day as skipped")
    void shouldCountRedeliveryAsSkipped() {
        when(engine.reconcile(any(CanonicalTapEvent.class))).thenReturn(result(ReconciliationOutcome.ALREADY_PROCESSED));

        MirrorSyncResult result = adapter.onEvent(TAG, Map.of("2025-03-10", new MirrorEntry("08:02:00", "17:31:45")));

        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Should keep processing other dates when one entry fails")
    void shouldIsolateEntryErrors() {
        Map<String, MirrorEntry> data = new LinkedHashMap<>();
        data.put("2025-03-07", new MirrorEntry("08:00:00", "17:00:00"));
        data.put("not-a-date", new MirrorEntry("08:00:00", null));
        data.put("2025-03-10", new MirrorEntry("08:02:00", null));
        data.put("2025-03-09", new MirrorEntry(null, null));

        when(engine.reconcile(argThat(e -> e != null && e.getDate().getDayOfMonth() == 7)))
                .thenThrow(new AttendanceRejectedException(RejectionReason.NO_ACTIVE_CHECKIN));
        when(engine.reconcile(argThat(e -> e != null && e.getDate().getDayOfMonth() == 10)))
                .thenReturn(result(ReconciliationOutcome.CREATED));

        MirrorSyncResult result = adapter.onEvent(TAG, data);

        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getErrors()).hasSize(2);
        assertThat(result.getErrors()).anyMatch(e -> e.contains("NO_ACTIVE_CHECKIN"));
        assertThat(result.getErrors()).anyMatch(e -> e.contains("not-a-date"));
    }

    @Test
    @DisplayName("Should accept the flattened webhook payload")
    void shouldHandleFlattenedRequest() {
        when(engine.reconcile(any(CanonicalTapEvent.class))).thenReturn(result(ReconciliationOutcome.CREATED));
        MirrorSyncRequest request = new MirrorSyncRequest();
        request.setTagId(TAG);
        request.setDate("2025-03-10");
        request.setCheckIn("08:02:00");

        MirrorSyncResult result = adapter.handle(request);

        assertThat(result.getCreated()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a webhook without tag or data")
    void shouldRejectIncompleteRequest() {
        MirrorSyncRequest noTag = new MirrorSyncRequest();
        MirrorSyncRequest noData = new MirrorSyncRequest();
        noData.setTagId(TAG);

        assertThatThrownBy(() -> adapter.handle(noTag))
                .extracting("reason").isEqualTo(RejectionReason.MISSING_IDENTIFIER);
        assertThatThrownBy(() -> adapter.handle(noData))
                .extracting("reason").isEqualTo(RejectionReason.INVALID_PAYLOAD);
        verifyNoInteractions(engine);
    }

    @Test
    @DisplayName("Should sweep every tag of the snapshot")
    void shouldPollSnapshot() {
        when(snapshotClient.fetchAll()).thenReturn(Map.of(
                TAG, Map.of("2025-03-10", new MirrorEntry("08:02:00", null)),
                "11223344", Map.of("2025-03-10", new MirrorEntry("09:00:00", null))));
        when(engine.reconcile(any(CanonicalTapEvent.class)))
                .thenReturn(result(ReconciliationOutcome.CREATED), result(ReconciliationOutcome.ALREADY_PROCESSED));

        MirrorSyncResult result = adapter.pollSnapshot();

        assertThat(result.getProcessed()).isEqualTo(2);
        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getSkipped()).isEqualTo(1);
    }
}
