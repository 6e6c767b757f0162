package sp.sistemaspalacios.api_attendance.client.offline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OfflineTapRecorder Tests")
class OfflineTapRecorderTest {

    @Mock
    private AttendanceApiClient apiClient;

    @Mock
    private OfflineEventQueue queue;

    private OfflineTapRecorder recorder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T13:02:00Z"), ZoneId.of("America/Bogota"));
        recorder = new OfflineTapRecorder(apiClient, queue, new AttendanceProperties(), clock);
    }

    @Test
    @DisplayName("Should queue the tap with its original time when the network is down")
    void shouldQueueOnFailure() {
        when(apiClient.submit(any(PendingEvent.class))).thenReturn(SubmissionOutcome.FAILED);

        SubmissionOutcome outcome = recorder.record("04A2B3C4", PendingEventType.CHECKIN);

        assertThat(outcome).isEqualTo(SubmissionOutcome.FAILED);
        ArgumentCaptor<PendingEvent> captor = ArgumentCaptor.forClass(PendingEvent.class);
        verify(queue).enqueue(captor.capture());
        PendingEvent queued = captor.getValue();
        assertThat(queued.getTimestamp()).isEqualTo("2025-03-10T08:02:00-05:00");
        assertThat(queued.getReaderId()).isEqualTo("READER_001");
        assertThat(queued.getLocation()).isEqualTo("Main Entrance");
        assertThat(queued.getLocalId()).isNotBlank();
        assertThat(queued.getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not queue accepted or rejected taps")
    void shouldNotQueueAnsweredTaps() {
        when(apiClient.submit(any(PendingEvent.class)))
                .thenReturn(SubmissionOutcome.ACCEPTED, SubmissionOutcome.REJECTED);

        recorder.record("04A2B3C4", PendingEventType.CHECKIN);
        recorder.record("04A2B3C4", PendingEventType.CHECKOUT);

        verifyNoInteractions(queue);
    }
}
