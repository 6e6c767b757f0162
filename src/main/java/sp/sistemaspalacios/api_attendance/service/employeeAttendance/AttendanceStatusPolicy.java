package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceStatus;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Estado inicial del registro según la hora de entrada frente a la hora nominal.
 * Desactivada, todo registro nuevo queda PRESENT.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceStatusPolicy {

    private final AttendanceProperties properties;

    public AttendanceStatus statusFor(LocalDateTime timeIn) {
        AttendanceProperties.StatusPolicy policy = properties.getStatusPolicy();
        if (!policy.isEnabled()) {
            return AttendanceStatus.PRESENT;
        }

        LocalTime scheduledTime = policy.getNominalStart();
        long secondsDifference = ChronoUnit.SECONDS.between(scheduledTime, timeIn.toLocalTime());
        long minutesLate = secondsDifference / 60;

        if (minutesLate > policy.getHalfDayAfterMinutes()) {
            log.debug("Entrada {} min después de {}: media jornada", minutesLate, scheduledTime);
            return AttendanceStatus.HALF_DAY;
        }
        if (minutesLate > policy.getLateGraceMinutes()) {
            log.debug("Entrada {} min después de {}: tarde", minutesLate, scheduledTime);
            return AttendanceStatus.LATE;
        }
        return AttendanceStatus.PRESENT;
    }
}
