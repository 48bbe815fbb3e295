package villagecompute.messagegateway.integration.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.exceptions.ActionExecutionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * {@link ExportWriter} that appends batches to local files.
 *
 * <p>
 * <b>Formats:</b>
 * <ul>
 * <li>{@code json} - one JSON object per line</li>
 * <li>{@code markdown} - a heading per message followed by its text</li>
 * <li>{@code html} - a {@code div.message} per message inside a minimal document, closed by {@link #finish}</li>
 * </ul>
 */
@ApplicationScoped
public class FileExportWriter implements ExportWriter {

    private static final Logger LOG = Logger.getLogger(FileExportWriter.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private static final String HTML_HEADER = "<!DOCTYPE html>\n<html>\n<head><meta charset=\"utf-8\"><title>Export</title></head>\n<body>\n";
    private static final String HTML_FOOTER = "</body>\n</html>\n";

    @Inject
    ObjectMapper objectMapper;

    @Override
    public WriteResult write(List<HistoryRecord> records, ExportFormat format, Path destination) {
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            StringBuilder out = new StringBuilder();
            if (format == ExportFormat.HTML && (!Files.exists(destination) || Files.size(destination) == 0)) {
                out.append(HTML_HEADER);
            }
            for (HistoryRecord record : records) {
                switch (format) {
                    case JSON -> out.append(toJsonLine(record)).append('\n');
                    case MARKDOWN -> out.append(toMarkdown(record));
                    case HTML -> out.append(toHtml(record));
                }
            }
            byte[] bytes = out.toString().getBytes(StandardCharsets.UTF_8);
            Files.write(destination, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            LOG.debugf("Appended %d records (%d bytes) to %s", records.size(), bytes.length, destination);
            return new WriteResult(destination, bytes.length);
        } catch (IOException e) {
            throw new ActionExecutionException("Failed to write export batch to " + destination, e);
        }
    }

    @Override
    public void finish(ExportFormat format, Path destination) {
        if (format != ExportFormat.HTML || !Files.exists(destination)) {
            return;
        }
        try {
            Files.writeString(destination, HTML_FOOTER, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new ActionExecutionException("Failed to finalize export " + destination, e);
        }
    }

    private String toJsonLine(HistoryRecord record) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", record.id());
        node.put("date", record.date() == null ? null : record.date().toString());
        node.put("author", record.author());
        node.put("text", record.text());
        return objectMapper.writeValueAsString(node);
    }

    private String toMarkdown(HistoryRecord record) {
        return "### " + nullToEmpty(record.author()) + " (" + formatDate(record) + ")\n\n" + nullToEmpty(record.text())
                + "\n\n";
    }

    private String toHtml(HistoryRecord record) {
        return "<div class=\"message\" id=\"m" + record.id() + "\"><span class=\"author\">"
                + escapeHtml(record.author()) + "</span> <span class=\"date\">" + formatDate(record)
                + "</span><p>" + escapeHtml(record.text()) + "</p></div>\n";
    }

    private static String formatDate(HistoryRecord record) {
        return record.date() == null ? "" : DATE_FORMAT.format(record.date());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    static String escapeHtml(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
