package sp.sistemaspalacios.api_attendance.client.offline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FileBackedOfflineEventQueue Tests")
class FileBackedOfflineEventQueueTest {

    @TempDir
    Path tempDir;

    private Path file;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("offline-buffer.json");
        objectMapper = new ObjectMapper();
    }

    private static PendingEvent event(String localId, PendingEventType type, String timestamp) {
        return PendingEvent.builder()
                .localId(localId)
                .type(type)
                .tagId("04A2B3C4")
                .timestamp(timestamp)
                .readerId("READER_001")
                .location("Main Entrance")
                .build();
    }

    @Test
    @DisplayName("Should survive a restart")
    void shouldPersistAcrossInstances() {
        new FileBackedOfflineEventQueue(file, objectMapper)
                .enqueue(event("a", PendingEventType.CHECKIN, "2025-03-10T08:02:00-05:00"));

        FileBackedOfflineEventQueue reopened = new FileBackedOfflineEventQueue(file, objectMapper);

        assertThat(reopened.size()).isEqualTo(1);
        assertThat(reopened.pending().get(0).getType()).isEqualTo(PendingEventType.CHECKIN);
        assertThat(reopened.pending().get(0).getTimestamp()).isEqualTo("2025-03-10T08:02:00-05:00");
    }

    @Test
    @DisplayName("Should start empty on a missing or corrupt file")
    void shouldStartEmptyOnCorruptFile() throws IOException {
        assertThat(new FileBackedOfflineEventQueue(file, objectMapper).size()).isZero();

        Files.writeString(file, "{ not json ]");

        assertThat(new FileBackedOfflineEventQueue(file, objectMapper).size()).isZero();
    }

    @Test
    @DisplayName("Should replay in timestamp order and keep only unacknowledged entries")
    void shouldReplayInOrder() {
        FileBackedOfflineEventQueue queue = new FileBackedOfflineEventQueue(file, objectMapper);
        queue.enqueue(event("out", PendingEventType.CHECKOUT, "2025-03-10T17:31:45-05:00"));
        queue.enqueue(event("in", PendingEventType.CHECKIN, "2025-03-10T08:02:00-05:00"));
        queue.enqueue(event("dup", PendingEventType.CHECKIN, "2025-03-09T08:00:00-05:00"));
        queue.enqueue(event("bad", PendingEventType.CHECKIN, "2025-03-08T08:00:00-05:00"));
        queue.enqueue(event("down", PendingEventType.CHECKIN, "2025-03-07T08:00:00-05:00"));

        List<String> order = new ArrayList<>();
        ReplaySummary summary = queue.drainAndReplay(e -> {
            order.add(e.getLocalId());
            switch (e.getLocalId()) {
                case "dup":
                    return SubmissionOutcome.ALREADY_PROCESSED;
                case "bad":
                    return SubmissionOutcome.REJECTED;
                case "down":
                    throw new IllegalStateException("connection reset");
                default:
                    return SubmissionOutcome.ACCEPTED;
            }
        });

        assertThat(order).containsExactly("down", "bad", "dup", "in", "out");
        assertThat(summary.getAccepted()).isEqualTo(2);
        assertThat(summary.getAlreadyProcessed()).isEqualTo(1);
        assertThat(summary.getRejected()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getRemaining()).isEqualTo(2);

        List<PendingEvent> left = new FileBackedOfflineEventQueue(file, objectMapper).pending();
        assertThat(left).extracting(PendingEvent::getLocalId).containsExactly("down", "bad");
        assertThat(left).allMatch(e -> e.getAttempts() == 1);
        assertThat(left.get(0).getLastError()).isEqualTo("connection reset");
        assertThat(left.get(1).getLastError()).isEqualTo("REJECTED");
        assertThat(left.get(0).isParked()).isFalse();
        assertThat(left.get(1).isParked()).isTrue();
    }

    @Test
    @DisplayName("Should keep a rejected entry on disk without sending it again")
    void shouldParkRejectedEntries() {
        FileBackedOfflineEventQueue queue = new FileBackedOfflineEventQueue(file, objectMapper);
        queue.enqueue(event("unknown-tag", PendingEventType.CHECKIN, "2025-03-10T08:02:00-05:00"));
        queue.enqueue(event("in", PendingEventType.CHECKIN, "2025-03-11T08:00:00-05:00"));

        queue.drainAndReplay(e -> "unknown-tag".equals(e.getLocalId())
                ? SubmissionOutcome.REJECTED
                : SubmissionOutcome.FAILED);

        FileBackedOfflineEventQueue reopened = new FileBackedOfflineEventQueue(file, objectMapper);
        List<String> sent = new ArrayList<>();
        ReplaySummary summary = reopened.drainAndReplay(e -> {
            sent.add(e.getLocalId());
            return SubmissionOutcome.ACCEPTED;
        });

        assertThat(sent).containsExactly("in");
        assertThat(summary.getRejected()).isZero();
        assertThat(summary.getParked()).isEqualTo(1);
        assertThat(reopened.size()).isEqualTo(1);
        assertThat(reopened.replayableSize()).isZero();
        PendingEvent parked = reopened.pending().get(0);
        assertThat(parked.getLocalId()).isEqualTo("unknown-tag");
        assertThat(parked.getAttempts()).isEqualTo(1);
        assertThat(parked.getLastError()).isEqualTo("REJECTED");
    }

    @Test
    @DisplayName("Should keep failed entries across repeated replays")
    void shouldNeverDropOnFailure() {
        FileBackedOfflineEventQueue queue = new FileBackedOfflineEventQueue(file, objectMapper);
        queue.enqueue(event("a", PendingEventType.CHECKIN, "2025-03-10T08:02:00-05:00"));

        queue.drainAndReplay(e -> SubmissionOutcome.FAILED);
        queue.drainAndReplay(e -> SubmissionOutcome.FAILED);
        ReplaySummary last = queue.drainAndReplay(e -> SubmissionOutcome.ACCEPTED);

        assertThat(last.getSynced()).isEqualTo(1);
        assertThat(queue.size()).isZero();
    }
}
