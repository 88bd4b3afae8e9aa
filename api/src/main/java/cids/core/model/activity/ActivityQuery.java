package cids.core.model.activity;

/**
 * Filter for reading the activity log. Null criteria match everything.
 */
public record ActivityQuery(String subject, String clientId, ActivityAction action, int limit) {

    public ActivityQuery {
        if (limit <= 0) {
            limit = 100;
        }
    }

    public boolean matches(ActivityEntry entry) {
        return (subject == null || subject.equals(entry.subject()))
                && (clientId == null || clientId.equals(entry.clientId()))
                && (action == null || action == entry.action());
    }
}
