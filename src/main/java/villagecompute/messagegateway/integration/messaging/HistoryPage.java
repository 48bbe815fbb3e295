package villagecompute.messagegateway.integration.messaging;

import java.util.List;

/**
 * A page of history records plus the cursor to continue from.
 */
public record HistoryPage(List<HistoryRecord> records, String nextCursor) {

    public HistoryPage {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean isLast() {
        return records.isEmpty() || nextCursor == null;
    }
}
