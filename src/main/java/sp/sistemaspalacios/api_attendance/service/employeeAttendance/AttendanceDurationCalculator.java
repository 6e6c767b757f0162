package sp.sistemaspalacios.api_attendance.service.employeeAttendance;

import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;

@Service
public class AttendanceDurationCalculator {

    /** Minutos completos entre entrada y salida; nunca negativo. */
    public int minutesBetween(LocalDateTime timeIn, LocalDateTime timeOut) {
        if (timeIn == null || timeOut == null) {
            throw new IllegalArgumentException("Se requieren hora de entrada y de salida");
        }
        long minutes = Duration.between(timeIn, timeOut).toMinutes();
        return (int) Math.max(0, minutes);
    }
}
