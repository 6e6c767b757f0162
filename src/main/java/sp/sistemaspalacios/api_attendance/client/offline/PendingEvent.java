package sp.sistemaspalacios.api_attendance.client.offline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Marcación que no pudo enviarse en el momento. Conserva la hora original: al reenviarla
 * horas después el servidor deriva la misma clave y el mismo registro.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingEvent {
    private String localId;
    private PendingEventType type;
    private String tagId;
    /** ISO-8601 con offset, p. ej. 2025-03-10T08:02:00-05:00 */
    private String timestamp;
    private String readerId;
    private String location;
    private int attempts;
    private String lastError;
    /** Rechazada por el servidor (tarjeta desconocida, inactiva...): se conserva pero no se reenvía. */
    private boolean parked;
}
