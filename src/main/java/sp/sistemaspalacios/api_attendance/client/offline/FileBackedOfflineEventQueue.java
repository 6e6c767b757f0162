package sp.sistemaspalacios.api_attendance.client.offline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Cola persistida como arreglo JSON en disco. Cada cambio reescribe el archivo completo
 * (temporal + move) para que un corte de luz no deje el archivo a medias.
 */
@Slf4j
public class FileBackedOfflineEventQueue implements OfflineEventQueue {

    private static final TypeReference<List<PendingEvent>> LIST_TYPE = new TypeReference<>() {};

    private static final Comparator<PendingEvent> BY_TIMESTAMP =
            Comparator.comparing(FileBackedOfflineEventQueue::instantOf,
                    Comparator.nullsLast(Comparator.naturalOrder()));

    private final Path file;
    private final ObjectMapper objectMapper;
    private final List<PendingEvent> events;

    public FileBackedOfflineEventQueue(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.events = load();
    }

    @Override
    public synchronized void enqueue(PendingEvent event) {
        events.add(event);
        save();
        log.info("📦 Marcación guardada para reintento - Tag: {}, Tipo: {}, Pendientes: {}",
                event.getTagId(), event.getType(), events.size());
    }

    @Override
    public synchronized ReplaySummary drainAndReplay(Function<PendingEvent, SubmissionOutcome> submitter) {
        ReplaySummary summary = new ReplaySummary();
        List<PendingEvent> ordered = new ArrayList<>(events);
        ordered.sort(BY_TIMESTAMP);

        List<PendingEvent> remaining = new ArrayList<>();
        for (PendingEvent event : ordered) {
            if (event.isParked()) {
                remaining.add(event);
                continue;
            }
            SubmissionOutcome outcome;
            String error;
            try {
                outcome = submitter.apply(event);
                error = outcome.name();
            } catch (RuntimeException e) {
                log.warn("⚠️ Error reenviando {}: {}", event.getLocalId(), e.getMessage());
                outcome = SubmissionOutcome.FAILED;
                error = e.getMessage();
            }
            if (outcome == null) {
                outcome = SubmissionOutcome.FAILED;
                error = "sin respuesta";
            }

            summary.count(outcome);
            if (!outcome.isAcknowledged()) {
                event.setAttempts(event.getAttempts() + 1);
                event.setLastError(error);
                if (outcome == SubmissionOutcome.REJECTED) {
                    event.setParked(true);
                    log.warn("⚠️ Marcación {} rechazada por el servidor (Tag: {}), queda apartada sin reenvío. "
                            + "Revise la tarjeta o su asignación", event.getLocalId(), event.getTagId());
                }
                remaining.add(event);
            }
        }

        events.clear();
        events.addAll(remaining);
        save();

        summary.setRemaining(events.size());
        summary.setParked((int) events.stream().filter(PendingEvent::isParked).count());
        return summary;
    }

    @Override
    public synchronized List<PendingEvent> pending() {
        List<PendingEvent> copy = new ArrayList<>(events);
        copy.sort(BY_TIMESTAMP);
        return copy;
    }

    @Override
    public synchronized int size() {
        return events.size();
    }

    @Override
    public synchronized int replayableSize() {
        return (int) events.stream().filter(e -> !e.isParked()).count();
    }

    private List<PendingEvent> load() {
        if (!Files.exists(file)) {
            log.info("Cola offline vacía, no existe {}", file);
            return new ArrayList<>();
        }
        try {
            List<PendingEvent> loaded = objectMapper.readValue(file.toFile(), LIST_TYPE);
            log.info("📂 {} marcaciones pendientes cargadas desde {}", loaded == null ? 0 : loaded.size(), file);
            return loaded == null ? new ArrayList<>() : new ArrayList<>(loaded);
        } catch (IOException e) {
            log.error("❌ No se pudo leer la cola offline {}, se inicia vacía: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), events);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo guardar la cola offline en " + file, e);
        }
    }

    private static OffsetDateTime instantOf(PendingEvent event) {
        if (event.getTimestamp() == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(event.getTimestamp());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
