package sp.sistemaspalacios.api_attendance.entity.nfcTag;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "nfc_tags")
@Data
public class NfcTag {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tag_uid", nullable = false, unique = true)
    private String tagUid;

    // Nulo mientras la tarjeta no se haya asignado
    @Column(name = "employee_id")
    private Long employeeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TagStatus status = TagStatus.ACTIVE;

    @Column(name = "enrolled_at", nullable = false)
    private LocalDateTime enrolledAt;

    @Column(name = "enrolled_by")
    private String enrolledBy;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "reader_id")
    private String readerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (enrolledAt == null) {
            enrolledAt = createdAt;
        }
    }
}
