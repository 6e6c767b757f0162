package sp.sistemaspalacios.api_attendance.entity.employeeAttendance;

public enum TapAction {
    OPEN("checkin"),   // time-in
    CLOSE("checkout"); // time-out

    private final String wireName;

    TapAction(String wireName) {
        this.wireName = wireName;
    }

    /** Nombre que esperan los clientes: "checkin" / "checkout". */
    public String getWireName() {
        return wireName;
    }
}
