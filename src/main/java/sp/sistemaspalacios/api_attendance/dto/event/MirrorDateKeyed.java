package sp.sistemaspalacios.api_attendance.dto.event;

import lombok.Value;

import java.util.Map;

/**
 * Nodo del espejo para una tarjeta: {fecha: {check_in, check_out}}.
 */
@Value
public class MirrorDateKeyed implements RawTapEvent {
    String tagId;
    Map<String, MirrorEntry> entriesByDate;
}
