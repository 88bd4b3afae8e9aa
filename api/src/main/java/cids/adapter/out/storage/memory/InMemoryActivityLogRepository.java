package cids.adapter.out.storage.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import io.smallrye.mutiny.Uni;

import cids.core.model.activity.ActivityEntry;
import cids.core.model.activity.ActivityQuery;
import cids.core.port.out.ActivityLogRepository;

/**
 * Bounded in-memory activity log. The oldest entries are dropped first.
 */
public class InMemoryActivityLogRepository implements ActivityLogRepository {

    private final Deque<ActivityEntry> entries = new ArrayDeque<>();
    private final int maxEntries;

    public InMemoryActivityLogRepository(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    @Override
    public Uni<Void> append(ActivityEntry entry) {
        return Uni.createFrom().item(() -> {
            synchronized (entries) {
                entries.addFirst(entry);
                while (entries.size() > maxEntries) {
                    entries.removeLast();
                }
            }
            return null;
        });
    }

    @Override
    public Uni<List<ActivityEntry>> query(ActivityQuery query) {
        return Uni.createFrom().item(() -> {
            final var result = new ArrayList<ActivityEntry>();
            synchronized (entries) {
                for (var entry : entries) {
                    if (result.size() >= query.limit()) {
                        break;
                    }
                    if (query.matches(entry)) {
                        result.add(entry);
                    }
                }
            }
            return result;
        });
    }
}
