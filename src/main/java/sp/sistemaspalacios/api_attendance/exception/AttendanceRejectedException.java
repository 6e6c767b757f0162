package sp.sistemaspalacios.api_attendance.exception;

import lombok.Getter;

/**
 * Marcación rechazada con un motivo concreto. Nunca termina en un registro huérfano.
 */
@Getter
public class AttendanceRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public AttendanceRejectedException(RejectionReason reason) {
        this(reason, reason.getDefaultMessage());
    }

    public AttendanceRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AttendanceRejectedException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
