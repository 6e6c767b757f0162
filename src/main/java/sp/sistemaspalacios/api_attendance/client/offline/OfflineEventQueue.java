package sp.sistemaspalacios.api_attendance.client.offline;

import java.util.List;
import java.util.function.Function;

/**
 * Cola local de marcaciones pendientes del lector o la app.
 * Una entrada sale solo cuando el servidor la reconoce (aceptada o ya procesada).
 * Las rechazadas quedan apartadas en la cola y no se reenvían.
 */
public interface OfflineEventQueue {

    void enqueue(PendingEvent event);

    /**
     * Reenvía las entradas no apartadas en orden de hora de marcación.
     * Una excepción del {@code submitter} cuenta como {@link SubmissionOutcome#FAILED}.
     */
    ReplaySummary drainAndReplay(Function<PendingEvent, SubmissionOutcome> submitter);

    List<PendingEvent> pending();

    int size();

    /** Entradas que el próximo reenvío intentará enviar. */
    int replayableSize();
}
