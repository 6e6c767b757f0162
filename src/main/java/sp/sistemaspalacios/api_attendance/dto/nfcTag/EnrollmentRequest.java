package sp.sistemaspalacios.api_attendance.dto.nfcTag;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class EnrollmentRequest {
    @NotEmpty
    private String tagUid;
    @NotNull
    private Long employeeId;
    private String enrolledBy;
}
