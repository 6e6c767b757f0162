package sp.sistemaspalacios.api_attendance.client.offline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "attendance.client", name = "enabled", havingValue = "true")
public class OfflineReplayScheduler {

    private final OfflineEventQueue queue;
    private final AttendanceApiClient apiClient;

    @Scheduled(fixedDelayString = "${attendance.client.retry-interval:PT30S}")
    public void scheduledReplay() {
        replay();
    }

    /** @return null si no había nada que enviar o no hay conexión */
    public ReplaySummary replay() {
        int pending = queue.replayableSize();
        if (pending == 0) {
            return null;
        }
        if (!apiClient.isReachable()) {
            log.debug("Sin conexión, {} marcaciones siguen en cola", pending);
            return null;
        }

        log.info("🔄 Reenviando cola offline ({} marcaciones)", pending);
        ReplaySummary summary = queue.drainAndReplay(apiClient::submit);
        log.info("🔄 Cola offline - Sincronizadas: {}, Rechazadas: {}, Fallidas: {}, Pendientes: {}, Apartadas: {}",
                summary.getSynced(), summary.getRejected(), summary.getFailed(), summary.getRemaining(),
                summary.getParked());
        return summary;
    }
}
