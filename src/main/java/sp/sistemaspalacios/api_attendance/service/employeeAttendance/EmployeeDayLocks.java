package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Un solo escritor por (empleado, fecha) dentro de esta instancia.
 * Entre instancias, las restricciones únicas cubren las inserciones y la columna de
 * versión de {@code AttendanceRecord} cubre las modificaciones.
 */
@Component
public class EmployeeDayLocks {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public EmployeeDayLocks() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(Long employeeId, LocalDate date, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(Objects.hash(employeeId, date), STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
