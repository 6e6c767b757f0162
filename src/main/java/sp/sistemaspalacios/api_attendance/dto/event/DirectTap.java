package sp.sistemaspalacios.api_attendance.dto.event;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.EventSource;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.TapAction;

/**
 * Marcación enviada por un lector o por la app móvil (en línea o desde la cola offline).
 */
@Value
@Builder
public class DirectTap implements RawTapEvent {
    String tagId;
    Long employeeId;
    String occurredAt; // ISO-8601, con o sin offset; nulo = ahora
    String readerId;
    String location;
    Double latitude;
    Double longitude;
    String idempotencyKey;
    TapAction action;  // nulo cuando el llamador no sabe si es entrada o salida
    EventSource source;
}
