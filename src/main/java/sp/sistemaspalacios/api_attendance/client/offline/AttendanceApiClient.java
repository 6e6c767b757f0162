package sp.sistemaspalacios.api_attendance.client.offline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Envía marcaciones del lector a la API de asistencia.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "attendance.client", name = "enabled", havingValue = "true")
public class AttendanceApiClient {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final AttendanceProperties properties;

    public SubmissionOutcome submit(PendingEvent event) {
        AttendanceProperties.Client client = properties.getClient();
        String url = client.getApiBaseUrl() + "/api/attendance/" + event.getType().getPath();

        Map<String, Object> body = new HashMap<>();
        body.put("tagUid", event.getTagId());
        body.put("readerId", event.getReaderId());
        body.put("location", event.getLocation());
        body.put("timestamp", event.getTimestamp());
        body.put("idempotencyKey", event.getLocalId());

        try {
            ResponseEntity<Map<String, Object>> response =
                    restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers()), RESPONSE_TYPE);
            Map<String, Object> payload = response.getBody();
            if (payload != null && Boolean.TRUE.equals(payload.get("alreadyProcessed"))) {
                log.info("🔁 Marcación {} ya estaba registrada", event.getLocalId());
                return SubmissionOutcome.ALREADY_PROCESSED;
            }
            log.info("✅ Marcación {} enviada ({})", event.getLocalId(), event.getType());
            return SubmissionOutcome.ACCEPTED;

        } catch (HttpClientErrorException e) {
            log.warn("⚠️ Marcación {} rechazada: HTTP {} {}", event.getLocalId(),
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            return SubmissionOutcome.REJECTED;
        } catch (HttpServerErrorException e) {
            log.warn("⚠️ Error del servidor para {}: HTTP {}", event.getLocalId(), e.getStatusCode().value());
            return SubmissionOutcome.FAILED;
        } catch (RestClientException e) {
            log.warn("⚠️ Sin conexión con la API: {}", e.getMessage());
            return SubmissionOutcome.FAILED;
        }
    }

    /** Cualquier respuesta HTTP cuenta como conectado; solo un error de red no. */
    public boolean isReachable() {
        try {
            restTemplate.headForHeaders(properties.getClient().getApiBaseUrl());
            return true;
        } catch (RestClientResponseException e) {
            return true;
        } catch (ResourceAccessException e) {
            log.debug("API no disponible: {}", e.getMessage());
            return false;
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String token = properties.getClient().getApiToken();
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        return headers;
    }
}
