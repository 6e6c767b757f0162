package sp.sistemaspalacios.api_attendance.entity.employeeAttendance;

public enum CheckInMethod {
    NFC,
    MANUAL,
    GEOLOCATION
}
