package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceRecord;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceStatus;
import sp.sistemaspalacios.api_attendance.exception.ConcurrentAttendanceUpdateException;
import sp.sistemaspalacios.api_attendance.exception.DuplicateAttendanceException;
import sp.sistemaspalacios.api_attendance.repository.employeeAttendance.AttendanceRecordRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaAttendanceStore implements AttendanceStore {

    private final AttendanceRecordRepository repository;

    @Override
    public Optional<AttendanceRecord> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey);
    }

    @Override
    public Optional<AttendanceRecord> findByClientKey(String clientKey) {
        return repository.findByClientKey(clientKey);
    }

    @Override
    public Optional<AttendanceRecord> findByEmployeeAndDate(Long employeeId, LocalDate date) {
        return repository.findByEmployeeIdAndDate(employeeId, date);
    }

    @Override
    public Optional<AttendanceRecord> findOpen(Long employeeId, LocalDate date) {
        return repository.findByEmployeeIdAndDateAndTimeOutIsNull(employeeId, date);
    }

    @Override
    public List<AttendanceRecord> findByEmployee(Long employeeId) {
        return repository.findByEmployeeIdOrderByDateDesc(employeeId);
    }

    @Override
    public List<AttendanceRecord> findStaleOpen(LocalDate date) {
        return repository.findOpenBeforeExcludingStatus(date, AttendanceStatus.LEAVE);
    }

    @Override
    public AttendanceRecord insert(AttendanceRecord record) {
        try {
            // flush inmediato: la violación de la restricción única debe salir aquí
            return repository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateAttendanceException(
                    "Registro duplicado para empleado " + record.getEmployeeId() + " el " + record.getDate(), e);
        }
    }

    @Override
    public AttendanceRecord update(AttendanceRecord record) {
        try {
            return repository.saveAndFlush(record);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConcurrentAttendanceUpdateException(
                    "Registro " + record.getId() + " modificado por otra escritura", e);
        }
    }
}
