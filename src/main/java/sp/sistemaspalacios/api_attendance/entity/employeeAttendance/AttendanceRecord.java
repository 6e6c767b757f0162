package sp.sistemaspalacios.api_attendance.entity.employeeAttendance;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Registro canónico de asistencia: uno por empleado y día.
 * <p>
 * Se crea con la primera entrada del día y se modifica una sola vez con la salida.
 * Las restricciones únicas respaldan la deduplicación cuando dos rutas de ingreso
 * (lector y espejo) entregan la misma marcación a la vez.
 */
@Entity
@Table(name = "attendance_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_attendance_idempotency_key", columnNames = "idempotency_key"),
                @UniqueConstraint(name = "uk_attendance_client_key", columnNames = "client_key"),
                @UniqueConstraint(name = "uk_attendance_employee_date", columnNames = {"employee_id", "attendance_date"})
        })
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "attendance_date", nullable = false)
    private LocalDate date;

    @Column(name = "time_in", nullable = false)
    private LocalDateTime timeIn;

    @Column(name = "time_out")
    private LocalDateTime timeOut;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AttendanceStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "check_in_method", nullable = false)
    private CheckInMethod checkInMethod;

    @Enumerated(EnumType.STRING)
    private EventSource source;

    @Column(name = "tag_uid")
    private String tagId;

    // Clave de log derivada: tagId_fecha_horaEntrada
    @Column(name = "idempotency_key")
    private String idempotencyKey;

    // Clave enviada por el cliente, si la hubo
    @Column(name = "client_key")
    private String clientKey;

    @Column(name = "reader_id")
    private String readerId;

    private String location;
    private Double latitude;
    private Double longitude;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "synced_at")
    private LocalDateTime syncedAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    @Transient
    public boolean isOpen() {
        return timeOut == null;
    }
}
