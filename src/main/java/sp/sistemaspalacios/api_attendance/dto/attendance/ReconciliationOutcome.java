package sp.sistemaspalacios.api_attendance.dto.attendance;

public enum ReconciliationOutcome {
    CREATED,
    UPDATED,
    ALREADY_PROCESSED
}
