package sp.sistemaspalacios.api_attendance.dto.event;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.EventSource;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.TapAction;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Forma única de una marcación, sin importar por dónde entró.
 * <p>
 * {@code logKey} se deriva de forma determinista (tagId_fecha_horaEntrada), así el lector
 * y el espejo convergen en el mismo registro para la misma marcación física.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalTapEvent {
    String tagId;
    Long employeeId;
    LocalDateTime occurredAt; // hora local en la zona del negocio
    LocalDate date;
    String readerId;
    String location;
    Double latitude;
    Double longitude;
    TapAction action;
    EventSource source;
    String logKey;
    String clientKey;
    String metadata;
}
