package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceRecord;
import sp.sistemaspalacios.api_attendance.exception.ConcurrentAttendanceUpdateException;
import sp.sistemaspalacios.api_attendance.exception.DuplicateAttendanceException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Almacén durable de registros de asistencia que consume el motor de conciliación.
 * <p>
 * Las implementaciones deben rechazar con {@link DuplicateAttendanceException} un segundo
 * registro con la misma clave de idempotencia, la misma clave de cliente o el mismo
 * (empleado, fecha), y con {@link ConcurrentAttendanceUpdateException} la escritura de una
 * copia cuya versión ya no es la almacenada.
 */
public interface AttendanceStore {

    Optional<AttendanceRecord> findByIdempotencyKey(String idempotencyKey);

    Optional<AttendanceRecord> findByClientKey(String clientKey);

    Optional<AttendanceRecord> findByEmployeeAndDate(Long employeeId, LocalDate date);

    Optional<AttendanceRecord> findOpen(Long employeeId, LocalDate date);

    List<AttendanceRecord> findByEmployee(Long employeeId);

    /** Registros aún abiertos de días anteriores a {@code date} que no están en LEAVE. */
    List<AttendanceRecord> findStaleOpen(LocalDate date);

    AttendanceRecord insert(AttendanceRecord record);

    AttendanceRecord update(AttendanceRecord record);
}
