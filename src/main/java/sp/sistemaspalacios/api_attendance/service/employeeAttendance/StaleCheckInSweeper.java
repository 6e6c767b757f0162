package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceRecord;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceStatus;
import sp.sistemaspalacios.api_attendance.exception.ConcurrentAttendanceUpdateException;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Marca como LEAVE las entradas de días anteriores que nunca tuvieron salida.
 * No toca timeOut ni la duración, y no borra nada.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleCheckInSweeper {

    private final AttendanceStore store;
    private final EmployeeDayLocks locks;
    private final AttendanceProperties properties;
    private final TimeService timeService;

    @Scheduled(cron = "${attendance.stale-sweep.cron:0 5 0 * * *}")
    public void scheduledSweep() {
        if (!properties.getStaleSweep().isEnabled()) {
            return;
        }
        sweep(timeService.now().toLocalDate());
    }

    /**
     * @param cutoff se marcan los registros abiertos con fecha estrictamente anterior
     * @return ids de los registros marcados
     */
    public List<Long> sweep(LocalDate cutoff) {
        List<Long> ids = new ArrayList<>();
        for (AttendanceRecord stale : store.findStaleOpen(cutoff)) {
            Long id = locks.withLock(stale.getEmployeeId(), stale.getDate(), () -> markLeave(stale));
            if (id != null) {
                ids.add(id);
            }
        }
        if (!ids.isEmpty()) {
            log.info("🧹 {} entradas sin salida antes de {} marcadas como LEAVE", ids.size(), cutoff);
        }
        return ids;
    }

    // Se relee bajo el candado: una salida tardía pudo cerrar el registro después de la consulta
    private Long markLeave(AttendanceRecord stale) {
        AttendanceRecord record = store.findByEmployeeAndDate(stale.getEmployeeId(), stale.getDate())
                .filter(r -> r.isOpen() && r.getStatus() != AttendanceStatus.LEAVE)
                .orElse(null);
        if (record == null) {
            return null;
        }
        record.setStatus(AttendanceStatus.LEAVE);
        try {
            return store.update(record).getId();
        } catch (ConcurrentAttendanceUpdateException e) {
            log.warn("⚠️ Registro {} modificado durante el barrido, se omite: {}", record.getId(), e.getMessage());
            return null;
        }
    }
}
