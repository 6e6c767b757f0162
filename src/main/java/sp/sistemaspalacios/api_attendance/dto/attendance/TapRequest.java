package sp.sistemaspalacios.api_attendance.dto.attendance;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class TapRequest {
    @JsonAlias("tagUid")
    private String tagId;
    private Long employeeId;
    private String readerId;
    private String location;
    @JsonAlias("locationLatitude")
    private Double latitude;
    @JsonAlias("locationLongitude")
    private Double longitude;
    private String idempotencyKey;
    @JsonAlias("timestamp")
    private String occurredAt;
}
