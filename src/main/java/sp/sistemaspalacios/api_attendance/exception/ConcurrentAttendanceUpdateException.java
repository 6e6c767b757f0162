package sp.sistemaspalacios.api_attendance.exception;

/**
 * El registro cambió en el almacén después de leerlo (versión distinta).
 */
public class ConcurrentAttendanceUpdateException extends RuntimeException {

    public ConcurrentAttendanceUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
