package sp.sistemaspalacios.api_attendance.client.offline;

public enum PendingEventType {
    CHECKIN("checkin"),
    CHECKOUT("checkout");

    private final String path;

    PendingEventType(String path) {
        this.path = path;
    }

    /** Segmento final de la ruta en /api/attendance. */
    public String getPath() {
        return path;
    }
}
