package sp.sistemaspalacios.api_attendance.exception;

import org.springframework.http.HttpStatus;

public enum RejectionReason {
    TAG_NOT_FOUND(HttpStatus.BAD_REQUEST, "Tarjeta NFC no registrada"),
    TAG_INACTIVE(HttpStatus.BAD_REQUEST, "La tarjeta NFC no está activa"),
    TAG_NOT_ASSIGNED(HttpStatus.BAD_REQUEST, "La tarjeta NFC no está asignada a ningún empleado"),
    EMPLOYEE_NOT_FOUND(HttpStatus.BAD_REQUEST, "Empleado no encontrado"),
    INVALID_TIMESTAMP(HttpStatus.BAD_REQUEST, "Hora de marcación inválida"),
    NO_ACTIVE_CHECKIN(HttpStatus.NOT_FOUND, "No hay una entrada activa para hoy"),
    MISSING_IDENTIFIER(HttpStatus.BAD_REQUEST, "Se requiere tagId o employeeId"),
    MISSING_ACTION(HttpStatus.BAD_REQUEST, "La marcación no indica si es entrada o salida"),
    INVALID_PAYLOAD(HttpStatus.BAD_REQUEST, "Contenido de la marcación inválido"),
    TAG_ALREADY_ENROLLED(HttpStatus.CONFLICT, "La tarjeta NFC ya está registrada");

    private final HttpStatus status;
    private final String defaultMessage;

    RejectionReason(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
