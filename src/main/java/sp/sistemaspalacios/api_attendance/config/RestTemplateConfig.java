package sp.sistemaspalacios.api_attendance.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RestTemplateConfig {

    // Timeouts cortos: el espejo y la API se reintentan desde fuera, nunca aquí
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    public Clock clock(AttendanceProperties properties) {
        return Clock.system(properties.getZoneId());
    }
}
