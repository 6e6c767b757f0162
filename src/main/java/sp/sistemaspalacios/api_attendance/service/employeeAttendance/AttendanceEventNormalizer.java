package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.dto.event.*;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.EventSource;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.TapAction;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.RejectionReason;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;
import sp.sistemaspalacios.api_attendance.service.nfcTag.TagDirectoryService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Convierte las tres formas de entrada (lector/móvil, espejo por fecha, espejo aplanado)
 * en {@link CanonicalTapEvent}.
 * <p>
 * La clave de log es {@code tagId + "_" + fecha + "_" + horaEntrada} y debe salir igual
 * por cualquier ruta: es el ancla de idempotencia.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceEventNormalizer {

    private final TimeService timeService;
    private final ObjectMapper objectMapper;

    public List<CanonicalTapEvent> normalize(RawTapEvent raw) {
        if (raw instanceof DirectTap) {
            return List.of(normalizeDirect((DirectTap) raw));
        }
        if (raw instanceof MirrorFlattened) {
            MirrorFlattened flat = (MirrorFlattened) raw;
            return normalizeMirrorEntry(flat.getTagId(), flat.getDate(), flat.getEntry());
        }
        if (raw instanceof MirrorDateKeyed) {
            MirrorDateKeyed nested = (MirrorDateKeyed) raw;
            if (nested.getEntriesByDate() == null) {
                return Collections.emptyList();
            }
            List<CanonicalTapEvent> events = new ArrayList<>();
            // Orden cronológico por fecha, para que el resultado no dependa del orden del mapa
            for (Map.Entry<String, MirrorEntry> e : new TreeMap<>(nested.getEntriesByDate()).entrySet()) {
                events.addAll(normalizeMirrorEntry(nested.getTagId(), e.getKey(), e.getValue()));
            }
            return events;
        }
        throw new AttendanceRejectedException(RejectionReason.INVALID_PAYLOAD,
                "Tipo de marcación no soportado: " + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    public CanonicalTapEvent normalizeDirect(DirectTap tap) {
        String tagId = blankToNull(tap.getTagId());
        if (tagId == null && tap.getEmployeeId() == null) {
            throw new AttendanceRejectedException(RejectionReason.MISSING_IDENTIFIER);
        }
        if (tagId != null) {
            tagId = TagDirectoryService.normalizeUid(tagId);
        }

        LocalDateTime occurredAt = tap.getOccurredAt() == null
                ? timeService.now()
                : parseTimestamp(tap.getOccurredAt());
        requireNotInFuture(occurredAt);

        LocalDate date = occurredAt.toLocalDate();
        String keyBase = tagId != null ? tagId : "EMP" + tap.getEmployeeId();
        EventSource source = tap.getSource() != null
                ? tap.getSource()
                : (tagId != null ? EventSource.READER : EventSource.MANUAL);

        return CanonicalTapEvent.builder()
                .tagId(tagId)
                .employeeId(tap.getEmployeeId())
                .occurredAt(occurredAt)
                .date(date)
                .readerId(blankToNull(tap.getReaderId()))
                .location(blankToNull(tap.getLocation()))
                .latitude(tap.getLatitude())
                .longitude(tap.getLongitude())
                .action(tap.getAction())
                .source(source)
                .logKey(logKey(keyBase, date, occurredAt.toLocalTime()))
                .clientKey(blankToNull(tap.getIdempotencyKey()))
                .build();
    }

    /**
     * Expande la entrada de un día del espejo en cero, una o dos marcaciones.
     * La salida lleva la misma clave de log que la entrada que cierra.
     */
    public List<CanonicalTapEvent> normalizeMirrorEntry(String rawTagId, String dateKey, MirrorEntry entry) {
        String tagId = blankToNull(rawTagId);
        if (tagId == null) {
            throw new AttendanceRejectedException(RejectionReason.MISSING_IDENTIFIER, "Falta tagId en el espejo");
        }
        if (entry == null || blankToNull(entry.getCheckIn()) == null) {
            log.debug("Entrada del espejo sin check_in para {} en {}, se ignora", tagId, dateKey);
            return Collections.emptyList();
        }
        tagId = TagDirectoryService.normalizeUid(tagId);

        LocalDate date;
        LocalTime checkIn;
        try {
            date = timeService.parseDate(dateKey);
            checkIn = timeService.parseClock(entry.getCheckIn());
        } catch (IllegalArgumentException e) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_TIMESTAMP, e.getMessage(), e);
        }

        LocalDateTime openAt = date.atTime(checkIn);
        requireNotInFuture(openAt);

        CanonicalTapEvent open = CanonicalTapEvent.builder()
                .tagId(tagId)
                .occurredAt(openAt)
                .date(date)
                .action(TapAction.OPEN)
                .source(EventSource.MIRROR)
                .logKey(logKey(tagId, date, checkIn))
                .metadata(toJson(entry))
                .build();

        if (blankToNull(entry.getCheckOut()) == null) {
            return List.of(open);
        }

        LocalDateTime closeAt;
        try {
            closeAt = date.atTime(timeService.parseClock(entry.getCheckOut()));
        } catch (IllegalArgumentException e) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_TIMESTAMP, e.getMessage(), e);
        }
        requireNotInFuture(closeAt);

        return List.of(open, open.toBuilder()
                .occurredAt(closeAt)
                .action(TapAction.CLOSE)
                .build());
    }

    public String logKey(String keyBase, LocalDate date, LocalTime time) {
        return keyBase + "_" + date + "_" + timeService.formatClock(time);
    }

    private LocalDateTime parseTimestamp(String raw) {
        try {
            return timeService.parseTimestamp(raw);
        } catch (IllegalArgumentException e) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_TIMESTAMP, e.getMessage(), e);
        }
    }

    private void requireNotInFuture(LocalDateTime occurredAt) {
        if (timeService.isBeyondSkew(occurredAt)) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_TIMESTAMP,
                    "La hora de marcación no puede estar en el futuro: " + occurredAt);
        }
    }

    private String toJson(MirrorEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_PAYLOAD,
                    "No se pudo serializar la entrada del espejo", e);
        }
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
