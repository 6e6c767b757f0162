package sp.sistemaspalacios.api_attendance.controller.nfcTag;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.dto.nfcTag.EnrollmentRequest;
import sp.sistemaspalacios.api_attendance.entity.nfcTag.NfcTag;
import sp.sistemaspalacios.api_attendance.entity.nfcTag.TagStatus;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.service.nfcTag.TagDirectoryService;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
public class EnrollmentController {

    private final TagDirectoryService tagDirectory;

    // Registrar una tarjeta nueva para un empleado
    @PostMapping
    public ResponseEntity<Map<String, Object>> enroll(@Valid @RequestBody EnrollmentRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            NfcTag tag = tagDirectory.enroll(request.getTagUid(), request.getEmployeeId(), request.getEnrolledBy());
            response.put("success", true);
            response.put("tag", tag);
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (AttendanceRejectedException e) {
            return rejected(response, e);
        }
    }

    @GetMapping
    public List<NfcTag> listAll() {
        return tagDirectory.listAll();
    }

    @GetMapping("/tag/{tagUid}")
    public ResponseEntity<NfcTag> getByTag(@PathVariable String tagUid) {
        try {
            return ResponseEntity.ok(tagDirectory.findByTag(tagUid));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
    }

    /**
     * Cambiar estado (ACTIVE, INACTIVE, LOST, DAMAGED)
     * PATCH /api/enrollments/tag/{tagUid}/status  {"status": "LOST"}
     */
    @PatchMapping("/tag/{tagUid}/status")
    public ResponseEntity<Map<String, Object>> changeStatus(@PathVariable String tagUid,
                                                            @RequestBody Map<String, String> request) {
        Map<String, Object> response = new HashMap<>();
        try {
            TagStatus status = TagStatus.valueOf(String.valueOf(request.get("status")).toUpperCase());
            response.put("success", true);
            response.put("tag", tagDirectory.changeStatus(tagUid, status));
            return ResponseEntity.ok(response);
        } catch (ResourceNotFoundException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        } catch (IllegalArgumentException e) {
            response.put("success", false);
            response.put("error", "Estado inválido: " + request.get("status"));
            return ResponseEntity.badRequest().body(response);
        }
    }

    /**
     * Reasignar la tarjeta a otro empleado, o dejarla sin asignar con employeeId nulo
     * PATCH /api/enrollments/tag/{tagUid}/employee  {"employeeId": 12}
     */
    @PatchMapping("/tag/{tagUid}/employee")
    public ResponseEntity<Map<String, Object>> reassign(@PathVariable String tagUid,
                                                        @RequestBody Map<String, Object> request) {
        Map<String, Object> response = new HashMap<>();
        try {
            Object raw = request.get("employeeId");
            Long employeeId = raw == null ? null : ((Number) raw).longValue();
            response.put("success", true);
            response.put("tag", tagDirectory.reassign(tagUid, employeeId));
            return ResponseEntity.ok(response);
        } catch (ResourceNotFoundException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        } catch (AttendanceRejectedException e) {
            return rejected(response, e);
        } catch (ClassCastException e) {
            response.put("success", false);
            response.put("error", "employeeId debe ser numérico");
            return ResponseEntity.badRequest().body(response);
        }
    }

    private ResponseEntity<Map<String, Object>> rejected(Map<String, Object> response, AttendanceRejectedException e) {
        log.warn("⚠️ Registro de tarjeta rechazado: {} - {}", e.getReason(), e.getMessage());
        response.put("success", false);
        response.put("code", e.getReason().name());
        response.put("error", e.getMessage());
        return ResponseEntity.status(e.getReason().getStatus()).body(response);
    }
}
