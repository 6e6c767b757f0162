package sp.sistemaspalacios.api_attendance.service.nfcTag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.dto.nfcTag.TagResolution;
import sp.sistemaspalacios.api_attendance.entity.nfcTag.NfcTag;
import sp.sistemaspalacios.api_attendance.entity.nfcTag.TagStatus;
import sp.sistemaspalacios.api_attendance.exception.AttendanceRejectedException;
import sp.sistemaspalacios.api_attendance.exception.RejectionReason;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_attendance.repository.nfcTag.NfcTagRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.*;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TagDirectoryService Tests")
class TagDirectoryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 8, 2);

    @Mock
    private NfcTagRepository tagRepository;

    @Mock
    private EmployeeRepository employeeRepository;

    private TagDirectoryService tagDirectory;

    @BeforeEach
    void setUp() {
        AttendanceProperties properties = new AttendanceProperties();
        properties.setZoneId(ZoneOffset.UTC);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        tagDirectory = new TagDirectoryService(tagRepository, employeeRepository, new TimeService(properties, clock));
    }

    private NfcTag tag(String uid, Long employeeId, TagStatus status) {
        NfcTag tag = new NfcTag();
        tag.setTagUid(uid);
        tag.setEmployeeId(employeeId);
        tag.setStatus(status);
        return tag;
    }

    @Nested
    @DisplayName("Resolve")
    class Resolve {

        @Test
        @DisplayName("Should resolve an active assigned tag and touch it")
        void shouldResolveActiveTag() {
            when(tagRepository.findByTagUid("04A2B3C4")).thenReturn(Optional.of(tag("04A2B3C4", 7L, TagStatus.ACTIVE)));

            TagResolution resolution = tagDirectory.resolve("04:a2:b3:c4", "READER_001");

            assertThat(resolution.employeeId()).isEqualTo(7L);
            assertThat(resolution.status()).isEqualTo(TagStatus.ACTIVE);
            verify(tagRepository).touch("04A2B3C4", NOW, "READER_001");
        }

        @Test
        @DisplayName("Should reject unknown, inactive and unassigned tags")
        void shouldRejectUnusableTags() {
            when(tagRepository.findByTagUid("UNKNOWN")).thenReturn(Optional.empty());
            when(tagRepository.findByTagUid("LOSTTAG")).thenReturn(Optional.of(tag("LOSTTAG", 7L, TagStatus.LOST)));
            when(tagRepository.findByTagUid("NOBODY")).thenReturn(Optional.of(tag("NOBODY", null, TagStatus.ACTIVE)));

            assertThatThrownBy(() -> tagDirectory.resolve("UNKNOWN", null))
                    .extracting("reason").isEqualTo(RejectionReason.TAG_NOT_FOUND);
            assertThatThrownBy(() -> tagDirectory.resolve("LOSTTAG", null))
                    .extracting("reason").isEqualTo(RejectionReason.TAG_INACTIVE);
            assertThatThrownBy(() -> tagDirectory.resolve("NOBODY", null))
                    .extracting("reason").isEqualTo(RejectionReason.TAG_NOT_ASSIGNED);
            verify(tagRepository, never()).touch(any(), any(), any());
        }

        @Test
        @DisplayName("Should not fail the tap when lastUsedAt cannot be updated")
        void shouldTolerateTouchFailure() {
            when(tagRepository.findByTagUid("04A2B3C4")).thenReturn(Optional.of(tag("04A2B3C4", 7L, TagStatus.ACTIVE)));
            when(tagRepository.touch(any(), any(), any())).thenThrow(new IllegalStateException("db down"));

            assertThat(tagDirectory.resolve("04A2B3C4", null).employeeId()).isEqualTo(7L);
        }
    }

    @Nested
    @DisplayName("Enrollment")
    class Enrollment {

        @Test
        @DisplayName("Should enroll a new tag as ACTIVE")
        void shouldEnroll() {
            when(tagRepository.existsByTagUid("04A2B3C4")).thenReturn(false);
            when(employeeRepository.existsById(7L)).thenReturn(true);
            when(tagRepository.save(any(NfcTag.class))).thenAnswer(inv -> inv.getArgument(0));

            tagDirectory.enroll("04:A2:B3:C4", 7L, "admin");

            ArgumentCaptor<NfcTag> captor = ArgumentCaptor.forClass(NfcTag.class);
            verify(tagRepository).save(captor.capture());
            assertThat(captor.getValue().getTagUid()).isEqualTo("04A2B3C4");
            assertThat(captor.getValue().getStatus()).isEqualTo(TagStatus.ACTIVE);
            assertThat(captor.getValue().getEnrolledAt()).isEqualTo(NOW);
            assertThat(captor.getValue().getEnrolledBy()).isEqualTo("admin");
        }

        @Test
        @DisplayName("Should reject a duplicate UID")
        void shouldRejectDuplicate() {
            when(tagRepository.existsByTagUid("04A2B3C4")).thenReturn(true);

            assertThatThrownBy(() -> tagDirectory.enroll("04A2B3C4", 7L, null))
                    .isInstanceOf(AttendanceRejectedException.class)
                    .extracting("reason").isEqualTo(RejectionReason.TAG_ALREADY_ENROLLED);
            verify(tagRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject enrollment for an unknown employee")
        void shouldRejectUnknownEmployee() {
            when(tagRepository.existsByTagUid("04A2B3C4")).thenReturn(false);
            when(employeeRepository.existsById(99L)).thenReturn(false);

            assertThatThrownBy(() -> tagDirectory.enroll("04A2B3C4", 99L, null))
                    .extracting("reason").isEqualTo(RejectionReason.EMPLOYEE_NOT_FOUND);
        }

        @Test
        @DisplayName("Should change status and unassign")
        void shouldChangeStatusAndReassign() {
            NfcTag existing = tag("04A2B3C4", 7L, TagStatus.ACTIVE);
            when(tagRepository.findByTagUid("04A2B3C4")).thenReturn(Optional.of(existing));
            when(tagRepository.save(any(NfcTag.class))).thenAnswer(inv -> inv.getArgument(0));

            assertThat(tagDirectory.changeStatus("04A2B3C4", TagStatus.LOST).getStatus()).isEqualTo(TagStatus.LOST);
            assertThat(tagDirectory.reassign("04A2B3C4", null).getEmployeeId()).isNull();
        }

        @Test
        @DisplayName("Should throw not found for an unknown tag lookup")
        void shouldThrowNotFound() {
            when(tagRepository.findByTagUid("NOPE")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> tagDirectory.findByTag("nope"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
