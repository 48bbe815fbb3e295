package villagecompute.messagegateway.integration.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import villagecompute.messagegateway.exceptions.ActionExecutionException;
import villagecompute.messagegateway.integration.messaging.ExportWriter.WriteResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileExportWriterTest {

    private static final Instant DATE = Instant.parse("2024-03-05T09:15:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FileExportWriter writer;

    @BeforeEach
    void setUp() {
        writer = new FileExportWriter();
        writer.objectMapper = objectMapper;
    }

    @Test
    void testWrite_json_oneObjectPerLine() throws Exception {
        Path out = tempDir.resolve("chat.jsonl");

        WriteResult first = writer.write(List.of(new HistoryRecord(1, DATE, "alice", "hi")), ExportFormat.JSON, out);
        writer.write(List.of(new HistoryRecord(2, DATE, "bob", "line\nbreak")), ExportFormat.JSON, out);

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        JsonNode second = objectMapper.readTree(lines.get(1));
        assertEquals(2, second.get("id").asLong());
        assertEquals("line\nbreak", second.get("text").asText());
        assertEquals("2024-03-05T09:15:00Z", second.get("date").asText());
        assertEquals(out, first.path());
        assertEquals(lines.get(0).getBytes(StandardCharsets.UTF_8).length + 1, first.bytesWritten());
    }

    @Test
    void testWrite_markdown_headingPerMessage() throws Exception {
        Path out = tempDir.resolve("chat.md");

        writer.write(List.of(new HistoryRecord(1, DATE, "alice", "hello")), ExportFormat.MARKDOWN, out);

        assertEquals("### alice (2024-03-05 09:15:00)\n\nhello\n\n", Files.readString(out));
    }

    @Test
    void testWriteAndFinish_html_escapesAndClosesDocument() throws Exception {
        Path out = tempDir.resolve("nested").resolve("chat.html");

        writer.write(List.of(new HistoryRecord(1, DATE, "a&b", "<script>alert('x')</script>")), ExportFormat.HTML,
                out);
        writer.write(List.of(new HistoryRecord(2, null, null, "second")), ExportFormat.HTML, out);
        writer.finish(ExportFormat.HTML, out);

        String html = Files.readString(out);
        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertEquals(html.indexOf("<!DOCTYPE"), html.lastIndexOf("<!DOCTYPE"));
        assertTrue(html.contains("a&amp;b"));
        assertTrue(html.contains("&lt;script&gt;alert(&#39;x&#39;)&lt;/script&gt;"));
        assertFalse(html.contains("<script>"));
        assertTrue(html.contains("id=\"m2\""));
        assertTrue(html.endsWith("</body>\n</html>\n"));
    }

    @Test
    void testFinish_nonHtmlOrMissingFile_doesNothing() throws Exception {
        Path json = tempDir.resolve("chat.jsonl");
        writer.write(List.of(new HistoryRecord(1, DATE, "alice", "hi")), ExportFormat.JSON, json);
        String before = Files.readString(json);

        writer.finish(ExportFormat.JSON, json);
        writer.finish(ExportFormat.HTML, tempDir.resolve("never-written.html"));

        assertEquals(before, Files.readString(json));
        assertFalse(Files.exists(tempDir.resolve("never-written.html")));
    }

    @Test
    void testWrite_destinationIsDirectory_throwsActionExecution() {
        assertThrows(ActionExecutionException.class,
                () -> writer.write(List.of(new HistoryRecord(1, DATE, "a", "b")), ExportFormat.JSON, tempDir));
    }

    @Test
    void testEscapeHtml_null_isEmpty() {
        assertEquals("", FileExportWriter.escapeHtml(null));
        assertEquals("plain", FileExportWriter.escapeHtml("plain"));
    }
}
