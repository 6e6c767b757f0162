package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceRecord;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.TapAction;

@Value
@Builder
public class ReconciliationResult {
    AttendanceRecord record;
    TapAction action;
    ReconciliationOutcome outcome;
    String message;

    public boolean isAlreadyProcessed() {
        return outcome == ReconciliationOutcome.ALREADY_PROCESSED;
    }

    public static ReconciliationResult alreadyProcessed(AttendanceRecord record, TapAction action, String message) {
        return ReconciliationResult.builder()
                .record(record)
                .action(action)
                .outcome(ReconciliationOutcome.ALREADY_PROCESSED)
                .message(message)
                .build();
    }
}
