package sp.sistemaspalacios.api_attendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    /** Zona en la que se deriva la fecha de cada marcación. */
    private ZoneId zoneId = ZoneId.systemDefault();

    private DispatchMode dispatchMode = DispatchMode.EXPLICIT;

    /** Tolerancia para marcaciones que llegan con hora en el futuro. */
    private Duration maxClockSkew = Duration.ofMinutes(5);

    private StatusPolicy statusPolicy = new StatusPolicy();
    private Mirror mirror = new Mirror();
    private Client client = new Client();
    private StaleSweep staleSweep = new StaleSweep();
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    public enum DispatchMode {
        EXPLICIT, // el llamador indica entrada o salida
        TOGGLE    // un solo lector: se deduce del estado del día
    }

    @Data
    public static class StatusPolicy {
        private boolean enabled = false;
        @DateTimeFormat(pattern = "HH:mm")
        private LocalTime nominalStart = LocalTime.of(9, 0);
        private int lateGraceMinutes = 15;
        private int halfDayAfterMinutes = 240;
    }

    @Data
    public static class Mirror {
        private String secret;
        private String databaseUrl;
        private String authToken;
        private String rootPath = "attendance";
        private boolean pollEnabled = false;
        private Duration pollInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Client {
        private boolean enabled = false;
        private String apiBaseUrl = "http://localhost:8080";
        private String apiToken;
        private String readerId = "READER_001";
        private String location = "Main Entrance";
        private String queueFile = "offline-buffer.json";
        private Duration retryInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class StaleSweep {
        private boolean enabled = false;
        private String cron = "0 5 0 * * *";
    }
}
