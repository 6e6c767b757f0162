package sp.sistemaspalacios.api_attendance.service.mirror;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MirrorPollScheduler Tests")
class MirrorPollSchedulerTest {

    @Mock
    private MirrorSyncAdapter adapter;

    private AttendanceProperties properties;
    private MirrorPollScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AttendanceProperties();
        scheduler = new MirrorPollScheduler(adapter, properties);
    }

    @Test
    @DisplayName("Should not poll while polling is disabled")
    void shouldSkipWhenDisabled() {
        scheduler.poll();

        verifyNoInteractions(adapter);
    }

    @Test
    @DisplayName("Should merge the snapshot when polling is enabled")
    void shouldPollWhenEnabled() {
        properties.getMirror().setPollEnabled(true);

        scheduler.poll();

        verify(adapter).pollSnapshot();
    }

    @Test
    @DisplayName("Should survive an unreachable mirror")
    void shouldSurviveUnreachableMirror() {
        properties.getMirror().setPollEnabled(true);
        when(adapter.pollSnapshot()).thenThrow(new ResourceAccessException("Connection refused"));

        assertThatCode(() -> scheduler.poll()).doesNotThrowAnyException();
    }
}
