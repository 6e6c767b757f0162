package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationResult;
import sp.sistemaspalacios.api_attendance.dto.attendance.TapRequest;
import sp.sistemaspalacios.api_attendance.dto.event.CanonicalTapEvent;
import sp.sistemaspalacios.api_attendance.dto.event.DirectTap;
import sp.sistemaspalacios.api_attendance.entity.employee.Employee;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceRecord;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.EventSource;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.TapAction;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.util.List;
import java.util.Optional;

/**
 * Entrada de las marcaciones que llegan por HTTP (lector o app móvil) y consultas del día.
 */
@Service
@RequiredArgsConstructor
public class EmployeeAttendanceService {

    private final AttendanceEventNormalizer normalizer;
    private final AttendanceReconciliationEngine engine;
    private final AttendanceStore store;
    private final EmployeeRepository employeeRepository;
    private final TimeService timeService;

    /**
     * @param action nulo cuando el llamador no indica entrada o salida (ver modo de despacho)
     */
    public ReconciliationResult registerTap(TapRequest request, TapAction action) {
        DirectTap tap = DirectTap.builder()
                .tagId(request.getTagId())
                .employeeId(request.getEmployeeId())
                .occurredAt(request.getOccurredAt())
                .readerId(request.getReaderId())
                .location(request.getLocation())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .idempotencyKey(request.getIdempotencyKey())
                .action(action)
                .source(sourceOf(request))
                .build();

        CanonicalTapEvent event = normalizer.normalizeDirect(tap);
        return engine.reconcile(event);
    }

    public Optional<AttendanceRecord> getToday(Long employeeId) {
        requireEmployee(employeeId);
        return store.findByEmployeeAndDate(employeeId, timeService.now().toLocalDate());
    }

    public List<AttendanceRecord> getHistory(Long employeeId) {
        requireEmployee(employeeId);
        return store.findByEmployee(employeeId);
    }

    public Optional<Employee> findEmployee(Long employeeId) {
        return employeeId == null ? Optional.empty() : employeeRepository.findById(employeeId);
    }

    private void requireEmployee(Long employeeId) {
        if (!employeeRepository.existsById(employeeId)) {
            throw new ResourceNotFoundException("Empleado no encontrado: " + employeeId);
        }
    }

    // La app móvil se identifica con readerId "MOBILE_APP"
    private static EventSource sourceOf(TapRequest request) {
        if (request.getTagId() == null || request.getTagId().isBlank()) {
            return EventSource.MANUAL;
        }
        return "MOBILE_APP".equalsIgnoreCase(request.getReaderId())
                ? EventSource.MOBILE
                : EventSource.READER;
    }
}
