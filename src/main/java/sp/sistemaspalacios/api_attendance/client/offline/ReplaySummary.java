package sp.sistemaspalacios.api_attendance.client.offline;

import lombok.Data;

@Data
public class ReplaySummary {
    private int accepted;
    private int alreadyProcessed;
    private int rejected;
    private int failed;
    private int remaining;
    private int parked;

    void count(SubmissionOutcome outcome) {
        switch (outcome) {
            case ACCEPTED:
                accepted++;
                break;
            case ALREADY_PROCESSED:
                alreadyProcessed++;
                break;
            case REJECTED:
                rejected++;
                break;
            default:
                failed++;
        }
    }

    public int getSynced() {
        return accepted + alreadyProcessed;
    }
}
