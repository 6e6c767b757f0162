package sp.sistemaspalacios.api_attendance.service.mirror;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

@Slf4j
@Service
@RequiredArgsConstructor
public class MirrorPollScheduler {

    private final MirrorSyncAdapter adapter;
    private final AttendanceProperties properties;

    @Scheduled(fixedDelayString = "${attendance.mirror.poll-interval:PT5M}",
            initialDelayString = "${attendance.mirror.poll-interval:PT5M}")
    public void poll() {
        if (!properties.getMirror().isPollEnabled()) {
            return;
        }
        try {
            adapter.pollSnapshot();
        } catch (RestClientException e) {
            // El próximo ciclo vuelve a intentar; el espejo conserva los datos
            log.warn("⚠️ Espejo no disponible: {}", e.getMessage());
        }
    }
}
