package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationOutcome;
import sp.sistemaspalacios.api_attendance.dto.attendance.ReconciliationResult;
import sp.sistemaspalacios.api_attendance.dto.event.CanonicalTapEvent;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.*;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.ConcurrentAttendanceUpdateException;
import sp.sistemaspalacios.api_attendance.exception.DuplicateAttendanceException;
import sp.sistemaspalacios.api_attendance.exception.RejectionReason;
import sp.sistemaspalacios.api_attendance.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;
import sp.sistemaspalacios.api_attendance.service.nfcTag.TagDirectoryService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Motor de conciliación de entradas y salidas.
 * <p>
 * Por (empleado, fecha): Ausente → Abierto → Cerrado. Cerrado es terminal para ese día.
 * Toda marcación repetida (cola offline, espejo reenviando el mismo nodo) devuelve el
 * registro existente marcado como ya procesado, nunca un error ni un segundo registro.
 * <p>
 * Las horas se toman de la marcación, no del orden de llegada: una entrada anterior a la
 * registrada adelanta {@code timeIn}, y la duración siempre se calcula desde el
 * {@code timeIn} almacenado.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceReconciliationEngine {

    private final AttendanceStore store;
    private final TagDirectoryService tagDirectory;
    private final EmployeeRepository employeeRepository;
    private final AttendanceStatusPolicy statusPolicy;
    private final AttendanceDurationCalculator durationCalculator;
    private final EmployeeDayLocks locks;
    private final AttendanceProperties properties;
    private final TimeService timeService;

    public ReconciliationResult reconcile(CanonicalTapEvent event) {
        if (event.getOccurredAt() == null || event.getDate() == null) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_TIMESTAMP, "Marcación sin hora");
        }
        Long employeeId = identifyEmployee(event);

        return locks.withLock(employeeId, event.getDate(), () -> {
            if (togglesOnDayState(event)) {
                // La entrada repetida vería el día abierto y se tomaría como salida
                Optional<AttendanceRecord> sameTap = findByKeys(event);
                if (sameTap.isPresent()) {
                    log.info("🔁 Marcación ya procesada (alternado) - Key: {}", event.getLogKey());
                    return ReconciliationResult.alreadyProcessed(sameTap.get(), TapAction.OPEN,
                            "Entrada ya procesada (idempotencia)");
                }
            }
            TapAction action = dispatch(event, employeeId);
            try {
                return apply(action, event, employeeId);
            } catch (DuplicateAttendanceException e) {
                return resolveLostRace(event, employeeId, action, e);
            } catch (ConcurrentAttendanceUpdateException e) {
                // Otra instancia cambió el registro entre la lectura y la escritura: se relee una vez
                log.warn("⚠️ Registro modificado por otra instancia - Employee: {}, Date: {}, se reintenta",
                        employeeId, event.getDate());
                try {
                    return apply(action, event, employeeId);
                } catch (DuplicateAttendanceException again) {
                    return resolveLostRace(event, employeeId, action, again);
                }
            }
        });
    }

    private ReconciliationResult apply(TapAction action, CanonicalTapEvent event, Long employeeId) {
        return action == TapAction.OPEN
                ? open(event, employeeId)
                : close(event, employeeId);
    }

    private boolean togglesOnDayState(CanonicalTapEvent event) {
        return event.getSource() != EventSource.MIRROR
                && properties.getDispatchMode() == AttendanceProperties.DispatchMode.TOGGLE;
    }

    /** Tarjeta → empleado, o el empleado indicado directamente. Nada se escribe antes de esto. */
    private Long identifyEmployee(CanonicalTapEvent event) {
        Long employeeId;
        if (event.getTagId() != null) {
            employeeId = tagDirectory.resolve(event.getTagId(), event.getReaderId()).employeeId();
        } else if (event.getEmployeeId() != null) {
            employeeId = event.getEmployeeId();
        } else {
            throw new AttendanceRejectedException(RejectionReason.MISSING_IDENTIFIER);
        }

        if (!employeeRepository.existsById(employeeId)) {
            throw new AttendanceRejectedException(RejectionReason.EMPLOYEE_NOT_FOUND,
                    "Empleado no encontrado: " + employeeId);
        }
        return employeeId;
    }

    private TapAction dispatch(CanonicalTapEvent event, Long employeeId) {
        if (event.getSource() == EventSource.MIRROR) {
            if (event.getAction() == null) {
                throw new AttendanceRejectedException(RejectionReason.INVALID_PAYLOAD,
                        "Marcación del espejo sin tipo: " + event.getLogKey());
            }
            return event.getAction();
        }

        if (togglesOnDayState(event)) {
            // Un solo lector: si hay entrada abierta hoy es salida, si no, entrada
            return store.findOpen(employeeId, event.getDate()).isPresent()
                    ? TapAction.CLOSE
                    : TapAction.OPEN;
        }

        if (event.getAction() == null) {
            throw new AttendanceRejectedException(RejectionReason.MISSING_ACTION);
        }
        return event.getAction();
    }

    private ReconciliationResult open(CanonicalTapEvent event, Long employeeId) {
        Optional<AttendanceRecord> sameTap = findByKeys(event);
        if (sameTap.isPresent()) {
            log.info("🔁 Entrada ya procesada - Key: {}", event.getLogKey());
            return ReconciliationResult.alreadyProcessed(sameTap.get(), TapAction.OPEN,
                    "Entrada ya procesada (idempotencia)");
        }

        LocalDateTime occurredAt = event.getOccurredAt();
        Optional<AttendanceRecord> today = store.findByEmployeeAndDate(employeeId, event.getDate());
        if (today.isPresent()) {
            AttendanceRecord record = today.get();
            if (occurredAt.isBefore(record.getTimeIn())) {
                return moveTimeInBack(record, event);
            }
            String message = record.isOpen()
                    ? "Ya registró entrada hoy"
                    : "La jornada de hoy ya está cerrada";
            log.info("🔁 {} - Employee: {}, Date: {}", message, employeeId, event.getDate());
            return ReconciliationResult.alreadyProcessed(record, TapAction.OPEN, message);
        }

        AttendanceRecord record = AttendanceRecord.builder()
                .employeeId(employeeId)
                .date(event.getDate())
                .timeIn(occurredAt)
                .status(statusPolicy.statusFor(occurredAt))
                .checkInMethod(checkInMethod(event))
                .source(event.getSource())
                .tagId(event.getTagId())
                .idempotencyKey(event.getLogKey())
                .clientKey(event.getClientKey())
                .readerId(event.getReaderId())
                .location(event.getLocation())
                .latitude(event.getLatitude())
                .longitude(event.getLongitude())
                .metadata(event.getMetadata())
                .syncedAt(event.getSource() == EventSource.MIRROR ? timeService.now() : null)
                .build();

        AttendanceRecord saved = store.insert(record);
        log.info("✅ Entrada registrada - Employee: {}, Time: {}, Source: {}, Key: {}",
                employeeId, occurredAt, event.getSource(), event.getLogKey());

        return ReconciliationResult.builder()
                .record(saved)
                .action(TapAction.OPEN)
                .outcome(ReconciliationOutcome.CREATED)
                .message("Entrada registrada correctamente")
                .build();
    }

    // Llega una entrada más temprana que la registrada: manda la hora de la marcación
    private ReconciliationResult moveTimeInBack(AttendanceRecord record, CanonicalTapEvent event) {
        LocalDateTime previous = record.getTimeIn();
        record.setTimeIn(event.getOccurredAt());
        record.setIdempotencyKey(event.getLogKey());
        if (record.getClientKey() == null) {
            record.setClientKey(event.getClientKey());
        }
        if (record.getStatus() != AttendanceStatus.LEAVE) {
            record.setStatus(statusPolicy.statusFor(event.getOccurredAt()));
        }
        if (!record.isOpen()) {
            record.setDurationMinutes(durationCalculator.minutesBetween(record.getTimeIn(), record.getTimeOut()));
        }

        AttendanceRecord saved = store.update(record);
        log.info("⏪ Entrada adelantada - Employee: {}, {} → {}",
                record.getEmployeeId(), previous, event.getOccurredAt());

        return ReconciliationResult.builder()
                .record(saved)
                .action(TapAction.OPEN)
                .outcome(ReconciliationOutcome.UPDATED)
                .message("Hora de entrada corregida a una marcación anterior")
                .build();
    }

    private ReconciliationResult close(CanonicalTapEvent event, Long employeeId) {
        LocalDate date = event.getDate();
        // El espejo trae la clave de la entrada que cierra; el lector no, se busca por día
        AttendanceRecord record = store.findByIdempotencyKey(event.getLogKey())
                .filter(r -> employeeId.equals(r.getEmployeeId()))
                .or(() -> store.findByEmployeeAndDate(employeeId, date))
                .orElseThrow(() -> new AttendanceRejectedException(RejectionReason.NO_ACTIVE_CHECKIN,
                        "No hay una entrada activa para el empleado " + employeeId + " el " + date));

        if (!record.isOpen()) {
            log.info("🔁 Salida ya registrada - Employee: {}, Date: {}", employeeId, record.getDate());
            return ReconciliationResult.alreadyProcessed(record, TapAction.CLOSE, "Salida ya registrada");
        }

        LocalDateTime timeOut = event.getOccurredAt();
        if (!timeOut.isAfter(record.getTimeIn())) {
            throw new AttendanceRejectedException(RejectionReason.INVALID_TIMESTAMP,
                    "La salida (" + timeOut + ") debe ser posterior a la entrada (" + record.getTimeIn() + ")");
        }

        int duration = durationCalculator.minutesBetween(record.getTimeIn(), timeOut);
        record.setTimeOut(timeOut);
        record.setDurationMinutes(duration);
        if (event.getSource() == EventSource.MIRROR) {
            record.setMetadata(event.getMetadata());
            record.setSyncedAt(timeService.now());
        }

        AttendanceRecord saved = store.update(record);
        log.info("✅ Salida registrada - Employee: {}, Time: {}, Duration: {} min",
                employeeId, timeOut, duration);

        return ReconciliationResult.builder()
                .record(saved)
                .action(TapAction.CLOSE)
                .outcome(ReconciliationOutcome.UPDATED)
                .message("Salida registrada correctamente. Duración: " + duration + " minutos")
                .build();
    }

    // Otra entrega de la misma marcación insertó primero (otra instancia o el espejo)
    private ReconciliationResult resolveLostRace(CanonicalTapEvent event, Long employeeId,
                                                 TapAction action, DuplicateAttendanceException e) {
        Optional<AttendanceRecord> winner = findByKeys(event)
                .or(() -> store.findByEmployeeAndDate(employeeId, event.getDate()));
        if (winner.isEmpty()) {
            throw e;
        }
        log.warn("⚠️ Entrega concurrente de la misma marcación - Key: {}, se devuelve el registro existente",
                event.getLogKey());
        return ReconciliationResult.alreadyProcessed(winner.get(), action, "Marcación ya procesada");
    }

    private Optional<AttendanceRecord> findByKeys(CanonicalTapEvent event) {
        Optional<AttendanceRecord> byLogKey = event.getLogKey() == null
                ? Optional.empty()
                : store.findByIdempotencyKey(event.getLogKey());
        if (byLogKey.isPresent() || event.getClientKey() == null) {
            return byLogKey;
        }
        return store.findByClientKey(event.getClientKey());
    }

    private static CheckInMethod checkInMethod(CanonicalTapEvent event) {
        if (event.getTagId() != null) {
            return CheckInMethod.NFC;
        }
        if (event.getLatitude() != null && event.getLongitude() != null) {
            return CheckInMethod.GEOLOCATION;
        }
        return CheckInMethod.MANUAL;
    }
}
