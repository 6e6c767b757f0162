package sp.sistemaspalacios.api_attendance.entity.employeeAttendance;

public enum AttendanceStatus {
    PRESENT,
    LATE,
    LEAVE,    // Entrada sin salida de un día anterior
    HALF_DAY
}
