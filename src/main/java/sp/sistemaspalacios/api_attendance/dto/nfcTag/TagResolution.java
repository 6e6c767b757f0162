package sp.sistemaspalacios.api_attendance.dto.nfcTag;

import sp.sistemaspalacios.api_attendance.entity.nfcTag.TagStatus;

public record TagResolution(String tagUid, Long employeeId, TagStatus status) {
}
