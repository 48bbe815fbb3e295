package villagecompute.messagegateway.integration.messaging;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes fetched history records to an export destination.
 *
 * <p>
 * Each call appends one batch. Failures are reported as
 * {@link villagecompute.messagegateway.exceptions.ActionExecutionException}.
 */
public interface ExportWriter {

    /**
     * Appends {@code records} to {@code destination}, creating it (with any format preamble) on first use.
     */
    WriteResult write(List<HistoryRecord> records, ExportFormat format, Path destination);

    /**
     * Closes out the document once the export completes. Formats without a trailer ignore this.
     */
    void finish(ExportFormat format, Path destination);

    record WriteResult(Path path, long bytesWritten) {
    }
}
