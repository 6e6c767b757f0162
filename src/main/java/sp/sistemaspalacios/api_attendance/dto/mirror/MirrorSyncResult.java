package sp.sistemaspalacios.api_attendance.dto.mirror;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MirrorSyncResult {
    private int created;
    private int updated;
    private int skipped;
    private List<String> errors = new ArrayList<>();

    public int getProcessed() {
        return created + updated + skipped + errors.size();
    }

    public void merge(MirrorSyncResult other) {
        created += other.created;
        updated += other.updated;
        skipped += other.skipped;
        errors.addAll(other.errors);
    }
}
