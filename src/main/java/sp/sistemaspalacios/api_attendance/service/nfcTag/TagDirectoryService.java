package sp.sistemaspalacios.api_attendance.service.nfcTag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.dto.nfcTag.TagResolution;
import sp.sistemaspalacios.api_attendance.entity.nfcTag.NfcTag;
import sp.sistemaspalacios.api_attendance.entity.nfcTag.TagStatus;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.RejectionReason;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_attendance.repository.nfcTag.NfcTagRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Directorio de tarjetas: tarjeta NFC → empleado y estado.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TagDirectoryService {

    private final NfcTagRepository tagRepository;
    private final EmployeeRepository employeeRepository;
    private final TimeService timeService;

    /**
     * Resuelve la tarjeta al empleado que la porta.
     *
     * @throws AttendanceRejectedException TAG_NOT_FOUND, TAG_INACTIVE o TAG_NOT_ASSIGNED
     */
    public TagResolution resolve(String rawTagUid, String readerId) {
        String tagUid = normalizeUid(rawTagUid);
        NfcTag tag = tagRepository.findByTagUid(tagUid)
                .orElseThrow(() -> new AttendanceRejectedException(
                        RejectionReason.TAG_NOT_FOUND, "Tarjeta NFC no registrada: " + tagUid));

        if (tag.getStatus() != TagStatus.ACTIVE) {
            throw new AttendanceRejectedException(RejectionReason.TAG_INACTIVE,
                    "La tarjeta " + tagUid + " está en estado " + tag.getStatus());
        }
        if (tag.getEmployeeId() == null) {
            throw new AttendanceRejectedException(RejectionReason.TAG_NOT_ASSIGNED,
                    "La tarjeta " + tagUid + " no está asignada a ningún empleado");
        }

        touch(tagUid, readerId);
        return new TagResolution(tag.getTagUid(), tag.getEmployeeId(), tag.getStatus());
    }

    // Solo informativo: un fallo aquí no debe tumbar la marcación
    private void touch(String tagUid, String readerId) {
        try {
            tagRepository.touch(tagUid, timeService.now(), readerId);
        } catch (RuntimeException e) {
            log.warn("⚠️ No se pudo actualizar lastUsedAt de la tarjeta {}: {}", tagUid, e.getMessage());
        }
    }

    public NfcTag findByTag(String tagUid) {
        return tagRepository.findByTagUid(normalizeUid(tagUid))
                .orElseThrow(() -> new ResourceNotFoundException("Tarjeta NFC no encontrada: " + tagUid));
    }

    public List<NfcTag> listAll() {
        return tagRepository.findAll();
    }

    @Transactional
    public NfcTag enroll(String tagUid, Long employeeId, String enrolledBy) {
        if (tagUid == null || tagUid.isBlank()) {
            throw new AttendanceRejectedException(RejectionReason.MISSING_IDENTIFIER, "El UID de la tarjeta es requerido");
        }
        String normalizedUid = normalizeUid(tagUid);
        if (tagRepository.existsByTagUid(normalizedUid)) {
            throw new AttendanceRejectedException(RejectionReason.TAG_ALREADY_ENROLLED,
                    "La tarjeta " + normalizedUid + " ya está registrada");
        }
        requireEmployee(employeeId);

        NfcTag tag = new NfcTag();
        tag.setTagUid(normalizedUid);
        tag.setEmployeeId(employeeId);
        tag.setStatus(TagStatus.ACTIVE);
        tag.setEnrolledAt(timeService.now());
        tag.setEnrolledBy(enrolledBy);

        NfcTag saved = tagRepository.save(tag);
        log.info("➕ Tarjeta {} registrada para empleado {}", normalizedUid, employeeId);
        return saved;
    }

    @Transactional
    public NfcTag changeStatus(String tagUid, TagStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("El estado es requerido");
        }
        NfcTag tag = findByTag(tagUid);
        TagStatus previous = tag.getStatus();
        tag.setStatus(status);
        NfcTag saved = tagRepository.save(tag);
        log.info("🔄 Tarjeta {}: {} → {}", tagUid, previous, status);
        return saved;
    }

    @Transactional
    public NfcTag reassign(String tagUid, Long employeeId) {
        NfcTag tag = findByTag(tagUid);
        if (employeeId != null) {
            requireEmployee(employeeId);
        }
        tag.setEmployeeId(employeeId);
        NfcTag saved = tagRepository.save(tag);
        log.info("🔄 Tarjeta {} asignada a empleado {}", tagUid, employeeId);
        return saved;
    }

    private void requireEmployee(Long employeeId) {
        if (employeeId == null || !employeeRepository.existsById(employeeId)) {
            throw new AttendanceRejectedException(RejectionReason.EMPLOYEE_NOT_FOUND,
                    "Empleado no encontrado: " + employeeId);
        }
    }

    // Los lectores web entregan "04:A2:..."; se guarda sin separadores y en mayúsculas
    public static String normalizeUid(String raw) {
        return raw.replace(":", "").trim().toUpperCase();
    }
}
