package sp.sistemaspalacios.api_attendance.client.offline;

public enum SubmissionOutcome {
    ACCEPTED,
    ALREADY_PROCESSED,
    REJECTED,
    FAILED;

    /** El servidor ya tiene la marcación; puede salir de la cola. */
    public boolean isAcknowledged() {
        return this == ACCEPTED || this == ALREADY_PROCESSED;
    }
}
