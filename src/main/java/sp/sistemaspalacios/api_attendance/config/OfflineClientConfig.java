package sp.sistemaspalacios.api_attendance.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import sp.sistemaspalacios.api_attendance.client.offline.FileBackedOfflineEventQueue;
import sp.sistemaspalacios.api_attendance.client.offline.OfflineEventQueue;

import java.nio.file.Path;

// Solo en el equipo del lector
@Configuration
@ConditionalOnProperty(prefix = "attendance.client", name = "enabled", havingValue = "true")
public class OfflineClientConfig {

    @Bean
    public OfflineEventQueue offlineEventQueue(AttendanceProperties properties, ObjectMapper objectMapper) {
        return new FileBackedOfflineEventQueue(Path.of(properties.getClient().getQueueFile()), objectMapper);
    }
}
