package sp.sistemaspalacios.api_attendance.entity.employeeAttendance;

public enum EventSource {
    READER,  // Lector NFC en sitio
    MOBILE,  // App móvil, en línea o reenviada desde la cola offline
    MIRROR,  // Base de datos espejo en tiempo real
    MANUAL   // Marcación por id de empleado sin tarjeta
}
