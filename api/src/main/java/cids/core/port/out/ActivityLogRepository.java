package cids.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import cids.core.model.activity.ActivityEntry;
import cids.core.model.activity.ActivityQuery;

/**
 * Append-only audit trail.
 */
public interface ActivityLogRepository {

    Uni<Void> append(ActivityEntry entry);

    /**
     * Matching entries, newest first.
     */
    Uni<List<ActivityEntry>> query(ActivityQuery query);
}
