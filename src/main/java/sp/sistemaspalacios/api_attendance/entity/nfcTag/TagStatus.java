package sp.sistemaspalacios.api_attendance.entity.nfcTag;

public enum TagStatus {
    ACTIVE,
    INACTIVE,
    LOST,
    DAMAGED
}
