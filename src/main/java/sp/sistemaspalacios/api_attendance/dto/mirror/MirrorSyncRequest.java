package sp.sistemaspalacios.api_attendance.dto.mirror;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import sp.sistemaspalacios.api_attendance.dto.event.MirrorEntry;

import java.util.Map;

/**
 * Cuerpo del webhook del espejo. Acepta las dos formas:
 * {tagId, data: {fecha: {check_in, check_out}}} o {tagId, date, check_in, check_out}.
 */
@Data
public class MirrorSyncRequest {
    @JsonAlias("tagUid")
    private String tagId;

    private Map<String, MirrorEntry> data;

    private String date;

    @JsonProperty("check_in")
    private String checkIn;

    @JsonProperty("check_out")
    private String checkOut;

    public boolean isFlattened() {
        return date != null && checkIn != null;
    }
}
