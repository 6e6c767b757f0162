package sp.sistemaspalacios.api_attendance.controller.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationOutcome;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationResult;
import sp.sistemaspalacios.api_attendance.dto.attendance.TapRequest;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceRecord;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.TapAction;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.RejectionReason;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;
import sp.sistemaspalacios.api_attendance.service.employeeAttendance.EmployeeAttendanceService;
import sp.sistemaspalacios.api_attendance.service.employeeAttendance.StaleCheckInSweeper;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class AttendanceController {

    private final EmployeeAttendanceService attendanceService;
    private final StaleCheckInSweeper staleCheckInSweeper;
    private final TimeService timeService;

    /**
     * Registrar entrada
     * POST /api/attendance/checkin
     */
    @PostMapping("/checkin")
    public ResponseEntity<Map<String, Object>> checkIn(@RequestBody TapRequest request) {
        return register(request, TapAction.OPEN);
    }

    /**
     * Registrar salida
     * POST /api/attendance/checkout
     */
    @PostMapping("/checkout")
    public ResponseEntity<Map<String, Object>> checkOut(@RequestBody TapRequest request) {
        return register(request, TapAction.CLOSE);
    }

    /**
     * Marcación sin tipo: el servidor decide entrada o salida
     * POST /api/attendance/tap
     */
    @PostMapping("/tap")
    public ResponseEntity<Map<String, Object>> tap(@RequestBody TapRequest request) {
        return register(request, null);
    }

    /**
     * Registro de hoy de un empleado
     * GET /api/attendance/today/{employeeId}
     */
    @GetMapping("/today/{employeeId}")
    public ResponseEntity<Map<String, Object>> getToday(@PathVariable Long employeeId) {
        Map<String, Object> response = new HashMap<>();
        try {
            Optional<AttendanceRecord> today = attendanceService.getToday(employeeId);
            response.put("success", true);
            response.put("attendance", today.orElse(null));
            response.put("checkedIn", today.isPresent());
            response.put("checkedOut", today.map(r -> !r.isOpen()).orElse(false));
            return ResponseEntity.ok(response);
        } catch (ResourceNotFoundException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
    }

    /**
     * Historial de un empleado, más reciente primero
     * GET /api/attendance/employee/{employeeId}
     */
    @GetMapping("/employee/{employeeId}")
    public ResponseEntity<Map<String, Object>> getHistory(@PathVariable Long employeeId) {
        Map<String, Object> response = new HashMap<>();
        try {
            List<AttendanceRecord> records = attendanceService.getHistory(employeeId);
            response.put("success", true);
            response.put("attendance", records);
            response.put("count", records.size());
            return ResponseEntity.ok(response);
        } catch (ResourceNotFoundException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
    }

    /**
     * Marcar como LEAVE las entradas sin salida de días anteriores
     * POST /api/attendance/mark-leave  {"cutoff_date": "2025-03-10"}
     */
    @PostMapping("/mark-leave")
    public ResponseEntity<Map<String, Object>> markLeave(@RequestBody(required = false) Map<String, String> request) {
        Map<String, Object> response = new HashMap<>();
        String rawCutoff = request == null ? null : request.get("cutoff_date");

        LocalDate cutoff;
        try {
            cutoff = rawCutoff == null ? timeService.now().toLocalDate() : timeService.parseDate(rawCutoff);
        } catch (IllegalArgumentException e) {
            response.put("success", false);
            response.put("code", RejectionReason.INVALID_TIMESTAMP.name());
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }

        List<Long> updated = staleCheckInSweeper.sweep(cutoff);
        response.put("success", true);
        response.put("message", "Se marcaron " + updated.size() + " registros como LEAVE");
        response.put("count", updated.size());
        response.put("updated_records", updated);
        response.put("cutoff_date", cutoff.toString());
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> register(TapRequest request, TapAction action) {
        Map<String, Object> response = new HashMap<>();

        try {
            ReconciliationResult result = attendanceService.registerTap(request, action);
            AttendanceRecord record = result.getRecord();

            response.put("success", true);
            response.put("message", result.getMessage());
            response.put("action", result.getAction().getWireName());
            response.put("alreadyProcessed", result.isAlreadyProcessed());
            response.put("attendance", record);
            attendanceService.findEmployee(record.getEmployeeId())
                    .ifPresent(employee -> response.put("employee", employee));

            HttpStatus status = result.getOutcome() == ReconciliationOutcome.CREATED
                    ? HttpStatus.CREATED
                    : HttpStatus.OK;
            return ResponseEntity.status(status).body(response);

        } catch (AttendanceRejectedException e) {
            log.warn("⚠️ Marcación rechazada: {} - {}", e.getReason(), e.getMessage());
            response.put("success", false);
            response.put("code", e.getReason().name());
            response.put("error", e.getMessage());
            return ResponseEntity.status(e.getReason().getStatus()).body(response);

        } catch (Exception e) {
            log.error("❌ Error registrando marcación: {}", e.getMessage(), e);
            response.put("success", false);
            response.put("error", "Error interno registrando la marcación");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
