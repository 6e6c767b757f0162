package sp.sistemaspalacios.api_attendance.service.mirror;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.dto.event.MirrorEntry;

import java.util.Collections;
import java.util.Map;

/**
 * Lee el nodo completo del espejo por su API REST: GET {database-url}/{root-path}.json
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MirrorSnapshotClient {

    private static final ParameterizedTypeReference<Map<String, Map<String, MirrorEntry>>> SNAPSHOT_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final AttendanceProperties properties;

    public Map<String, Map<String, MirrorEntry>> fetchAll() {
        AttendanceProperties.Mirror mirror = properties.getMirror();
        if (mirror.getDatabaseUrl() == null || mirror.getDatabaseUrl().isBlank()) {
            throw new IllegalStateException("attendance.mirror.database-url no está configurado");
        }

        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(mirror.getDatabaseUrl())
                .path("/" + mirror.getRootPath() + ".json");
        if (mirror.getAuthToken() != null && !mirror.getAuthToken().isBlank()) {
            uri.queryParam("auth", mirror.getAuthToken());
        }
        String url = uri.toUriString();

        log.debug("📥 Leyendo espejo: {}", mirror.getDatabaseUrl());
        ResponseEntity<Map<String, Map<String, MirrorEntry>>> response =
                restTemplate.exchange(url, HttpMethod.GET, null, SNAPSHOT_TYPE);

        // El espejo responde "null" cuando el nodo no existe
        Map<String, Map<String, MirrorEntry>> body = response.getBody();
        return body == null ? Collections.emptyMap() : body;
    }
}
