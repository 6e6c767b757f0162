package sp.sistemaspalacios.api_attendance.service.common;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

@Service
@RequiredArgsConstructor
public class TimeService {

    // Reloj del espejo: "HH:mm:ss"; se tolera "HH:mm"
    private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final AttendanceProperties properties;
    private final Clock clock;

    public ZoneId zone() {
        return properties.getZoneId();
    }

    /** Ahora, en la zona del negocio, truncado a segundos. */
    public LocalDateTime now() {
        return LocalDateTime.now(clock.withZone(zone())).truncatedTo(ChronoUnit.SECONDS);
    }

    /** Parsea "HH:mm:ss" o "HH:mm" estrictamente. */
    public LocalTime parseClock(String raw) {
        if (raw == null) throw new IllegalArgumentException("Hora nula");
        String s = raw.trim();
        try {
            return s.length() <= 5 ? LocalTime.parse(s, HH_MM) : LocalTime.parse(s, HH_MM_SS);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Hora inválida (HH:mm:ss): " + raw);
        }
    }

    /** Parsea "yyyy-MM-dd". */
    public LocalDate parseDate(String raw) {
        if (raw == null) throw new IllegalArgumentException("Fecha nula");
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Fecha inválida (yyyy-MM-dd): " + raw);
        }
    }

    /**
     * Convierte un timestamp ISO-8601 a hora local del negocio.
     * Con offset o 'Z' se convierte; sin offset se asume que ya es hora local.
     */
    public LocalDateTime parseTimestamp(String raw) {
        if (raw == null) throw new IllegalArgumentException("Timestamp nulo");
        String s = raw.trim();
        try {
            return OffsetDateTime.parse(s)
                    .atZoneSameInstant(zone())
                    .toLocalDateTime()
                    .truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException withoutOffset) {
            try {
                return LocalDateTime.parse(s).truncatedTo(ChronoUnit.SECONDS);
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Timestamp inválido (ISO-8601): " + raw);
            }
        }
    }

    /** Formatea a "HH:mm:ss", el formato que usa la clave de log. */
    public String formatClock(LocalTime t) {
        return (t == null) ? null : t.format(HH_MM_SS);
    }

    public boolean isBeyondSkew(LocalDateTime occurredAt) {
        return occurredAt.isAfter(now().plus(properties.getMaxClockSkew()));
    }
}
