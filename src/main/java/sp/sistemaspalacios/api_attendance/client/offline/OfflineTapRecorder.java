package sp.sistemaspalacios.api_attendance.client.offline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Punto de entrada del lector: intenta enviar en línea y, si no hay red, deja la marcación
 * en la cola local con su hora original.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "attendance.client", name = "enabled", havingValue = "true")
public class OfflineTapRecorder {

    private final AttendanceApiClient apiClient;
    private final OfflineEventQueue queue;
    private final AttendanceProperties properties;
    private final Clock clock;

    public SubmissionOutcome record(String tagId, PendingEventType type) {
        PendingEvent event = PendingEvent.builder()
                .localId(UUID.randomUUID().toString())
                .type(type)
                .tagId(tagId)
                .timestamp(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS)
                        .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME))
                .readerId(properties.getClient().getReaderId())
                .location(properties.getClient().getLocation())
                .build();
        return record(event);
    }

    public SubmissionOutcome record(PendingEvent event) {
        SubmissionOutcome outcome = apiClient.submit(event);
        if (outcome == SubmissionOutcome.FAILED) {
            event.setAttempts(1);
            event.setLastError(outcome.name());
            queue.enqueue(event);
        } else if (outcome == SubmissionOutcome.REJECTED) {
            log.warn("⚠️ Marcación {} de la tarjeta {} rechazada por el servidor", event.getLocalId(), event.getTagId());
        }
        return outcome;
    }
}
