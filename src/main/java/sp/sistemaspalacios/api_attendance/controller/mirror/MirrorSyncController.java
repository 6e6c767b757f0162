package sp.sistemaspalacios.api_attendance.controller.mirror;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.client.RestClientException;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.dto.mirror.MirrorSyncRequest;
import sp.sistemaspalacios.api_attendance.dto.mirror.MirrorSyncResult;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.service.mirror.MirrorSyncAdapter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/mirror")
@RequiredArgsConstructor
public class MirrorSyncController {

    static final String SECRET_HEADER = "X-Mirror-Secret";
    private static final int MAX_REPORTED_ERRORS = 10;

    private final MirrorSyncAdapter adapter;
    private final AttendanceProperties properties;

    /**
     * Webhook del espejo (nodo agregado o modificado)
     * POST /api/mirror/sync
     */
    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> sync(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @RequestBody MirrorSyncRequest request
    ) {
        Map<String, Object> response = new HashMap<>();
        if (!secretMatches(secret)) {
            response.put("success", false);
            response.put("error", "No autorizado");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
        }

        try {
            MirrorSyncResult result = adapter.handle(request);
            fillSummary(response, result);
            return ResponseEntity.ok(response);
        } catch (AttendanceRejectedException e) {
            response.put("success", false);
            response.put("code", e.getReason().name());
            response.put("error", e.getMessage());
            return ResponseEntity.status(e.getReason().getStatus()).body(response);
        }
    }

    /**
     * Sincronización completa bajo demanda
     * GET /api/mirror/poll
     */
    @GetMapping("/poll")
    public ResponseEntity<Map<String, Object>> poll(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret
    ) {
        Map<String, Object> response = new HashMap<>();
        if (!secretMatches(secret)) {
            response.put("success", false);
            response.put("error", "No autorizado");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
        }

        try {
            fillSummary(response, adapter.pollSnapshot());
            return ResponseEntity.ok(response);
        } catch (IllegalStateException | RestClientException e) {
            log.error("❌ Error consultando el espejo: {}", e.getMessage());
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
        }
    }

    private void fillSummary(Map<String, Object> response, MirrorSyncResult result) {
        response.put("success", true);
        response.put("processed", result.getProcessed());
        response.put("created", result.getCreated());
        response.put("updated", result.getUpdated());
        response.put("skipped", result.getSkipped());
        response.put("errors", result.getErrors().stream().limit(MAX_REPORTED_ERRORS).toList());
        response.put("errorCount", result.getErrors().size());
    }

    // Sin secreto configurado el webhook queda abierto (entornos locales)
    private boolean secretMatches(String provided) {
        String expected = properties.getMirror().getSecret();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return provided != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
