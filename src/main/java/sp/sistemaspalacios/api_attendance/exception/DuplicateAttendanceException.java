package sp.sistemaspalacios.api_attendance.exception;

/**
 * El almacén rechazó un registro por una restricción única: otra entrega de la misma
 * marcación ganó la carrera.
 */
public class DuplicateAttendanceException extends RuntimeException {

    public DuplicateAttendanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
