package sp.sistemaspalacios.api_attendance.service.mirror;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationOutcome;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationResult;
import sp.sistemaspalacios.api_attendance.dto.event.CanonicalTapEvent;
import sp.sistemaspalacios.api_attendance.dto.event.MirrorEntry;
import sp.sistemaspalacios.api_attendance.dto.event.MirrorFlattened;
import sp.sistemaspalacios.api_attendance.dto.mirror.MirrorSyncRequest;
import sp.sistemaspalacios.api_attendance.dto.mirror.MirrorSyncResult;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.RejectionReason;
import sp.sistemaspalacios.api_attendance.service.employeeAttendance.AttendanceEventNormalizer;
import sp.sistemaspalacios.api_attendance.service.employeeAttendance.AttendanceReconciliationEngine;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ingreso secundario desde el espejo en tiempo real.
 * <p>
 * Las notificaciones "added" y "changed" llegan al mismo {@link #onEvent}. Puede invocarse
 * varias veces con el mismo contenido: la deduplicación es la del motor, aquí no hay otra.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MirrorSyncAdapter {

    private final AttendanceEventNormalizer normalizer;
    private final AttendanceReconciliationEngine engine;
    private final MirrorSnapshotClient snapshotClient;

    public MirrorSyncResult handle(MirrorSyncRequest request) {
        if (request.getTagId() == null || request.getTagId().isBlank()) {
            throw new AttendanceRejectedException(RejectionReason.MISSING_IDENTIFIER, "Falta tagId");
        }
        if (request.isFlattened()) {
            return onFlattened(request.getTagId(), request.getDate(),
                    new MirrorEntry(request.getCheckIn(), request.getCheckOut()));
        }
        if (request.getData() == null) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_PAYLOAD,
                    "Se requiere 'data' o el par 'date'/'check_in'");
        }
        return onEvent(request.getTagId(), request.getData());
    }

    public MirrorSyncResult onEvent(String tagId, Map<String, MirrorEntry> dateKeyedPayload) {
        MirrorSyncResult result = new MirrorSyncResult();
        if (dateKeyedPayload == null) {
            return result;
        }
        for (Map.Entry<String, MirrorEntry> e : new TreeMap<>(dateKeyedPayload).entrySet()) {
            processEntry(tagId, e.getKey(), e.getValue(), result);
        }
        return result;
    }

    public MirrorSyncResult onFlattened(String tagId, String date, MirrorEntry entry) {
        MirrorSyncResult result = new MirrorSyncResult();
        processEntry(tagId, date, entry, result);
        return result;
    }

    /** Recorre todo el nodo del espejo, tarjeta por tarjeta. */
    public MirrorSyncResult pollSnapshot() {
        long start = System.currentTimeMillis();
        Map<String, Map<String, MirrorEntry>> snapshot = snapshotClient.fetchAll();

        MirrorSyncResult total = new MirrorSyncResult();
        snapshot.forEach((tagId, data) -> total.merge(onEvent(tagId, data)));

        log.info("🔄 Sincronización del espejo - Created: {}, Updated: {}, Skipped: {}, Errors: {} ({} ms)",
                total.getCreated(), total.getUpdated(), total.getSkipped(), total.getErrors().size(),
                System.currentTimeMillis() - start);
        return total;
    }

    // Un error en una fecha no detiene las demás
    private void processEntry(String tagId, String dateKey, MirrorEntry entry, MirrorSyncResult result) {
        String label = tagId + "_" + dateKey;
        try {
            List<CanonicalTapEvent> events = normalizer.normalize(new MirrorFlattened(tagId, dateKey, entry));
            if (events.isEmpty()) {
                return;
            }

            ReconciliationOutcome combined = ReconciliationOutcome.ALREADY_PROCESSED;
            for (CanonicalTapEvent event : events) {
                label = event.getLogKey();
                ReconciliationResult r = engine.reconcile(event);
                combined = stronger(combined, r.getOutcome());
            }

            switch (combined) {
                case CREATED:
                    result.setCreated(result.getCreated() + 1);
                    break;
                case UPDATED:
                    result.setUpdated(result.getUpdated() + 1);
                    break;
                default:
                    result.setSkipped(result.getSkipped() + 1);
            }
        } catch (AttendanceRejectedException e) {
            log.warn("⚠️ [{}] Marcación del espejo rechazada: {} - {}", label, e.getReason(), e.getMessage());
            result.getErrors().add(label + ": " + e.getReason() + " - " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ [{}] Error procesando marcación del espejo: {}", label, e.getMessage(), e);
            result.getErrors().add(label + ": " + e.getMessage());
        }
    }

    private static ReconciliationOutcome stronger(ReconciliationOutcome a, ReconciliationOutcome b) {
        if (a == ReconciliationOutcome.CREATED || b == ReconciliationOutcome.CREATED) {
            return ReconciliationOutcome.CREATED;
        }
        if (a == ReconciliationOutcome.UPDATED || b == ReconciliationOutcome.UPDATED) {
            return ReconciliationOutcome.UPDATED;
        }
        return ReconciliationOutcome.ALREADY_PROCESSED;
    }
}
