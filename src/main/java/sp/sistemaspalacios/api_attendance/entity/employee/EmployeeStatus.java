package sp.sistemaspalacios.api_attendance.entity.employee;

public enum EmployeeStatus {
    ACTIVE,
    INACTIVE
}
