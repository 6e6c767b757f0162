package sp.sistemaspalacios.api_attendance.dto.event;

import lombok.Value;

/**
 * Variante aplanada de un solo día: {tagId, date, check_in, check_out}.
 */
@Value
public class MirrorFlattened implements RawTapEvent {
    String tagId;
    String date;
    MirrorEntry entry;
}
