package sp.sistemaspalacios.api_attendance.service.common;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

import java.time.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeService Tests")
class TimeServiceTest {

    private TimeService timeService;

    @BeforeEach
    void setUp() {
        AttendanceProperties properties = new AttendanceProperties();
        properties.setZoneId(ZoneId.of("America/Bogota"));
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T13:02:00.750Z"), ZoneOffset.UTC);
        timeService = new TimeService(properties, clock);
    }

    @Test
    @DisplayName("Should give now in the business zone truncated to seconds")
    void shouldGiveNowInZone() {
        assertThat(timeService.now()).isEqualTo(LocalDateTime.of(2025, 3, 10, 8, 2, 0));
    }

    @Test
    @DisplayName("Should convert offset timestamps and keep local ones")
    void shouldParseTimestamps() {
        assertThat(timeService.parseTimestamp("2025-03-10T13:02:00Z"))
                .isEqualTo(LocalDateTime.of(2025, 3, 10, 8, 2));
        assertThat(timeService.parseTimestamp("2025-03-10T08:02:00.123"))
                .isEqualTo(LocalDateTime.of(2025, 3, 10, 8, 2));
        assertThatThrownBy(() -> timeService.parseTimestamp("10/03/2025 08:02"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should parse and format mirror clock values")
    void shouldHandleClockValues() {
        assertThat(timeService.parseClock("17:31:45")).isEqualTo(LocalTime.of(17, 31, 45));
        assertThat(timeService.parseClock("08:02")).isEqualTo(LocalTime.of(8, 2));
        assertThat(timeService.formatClock(LocalTime.of(8, 2))).isEqualTo("08:02:00");
        assertThatThrownBy(() -> timeService.parseClock("25:00:00"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should flag timestamps beyond the clock skew")
    void shouldDetectSkew() {
        assertThat(timeService.isBeyondSkew(LocalDateTime.of(2025, 3, 10, 8, 6))).isFalse();
        assertThat(timeService.isBeyondSkew(LocalDateTime.of(2025, 3, 10, 8, 8))).isTrue();
    }
}
