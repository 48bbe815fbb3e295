package villagecompute.messagegateway.integration.messaging;

import villagecompute.messagegateway.exceptions.ValidationException;

import java.util.Locale;

/**
 * Output formats understood by {@link ExportWriter}.
 */
public enum ExportFormat {
    HTML("html"), MARKDOWN("md"), JSON("jsonl");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExportFormat fromWire(String value) {
        if (value == null) {
            throw ValidationException.invalidConfig("export_format is required");
        }
        for (ExportFormat format : values()) {
            if (format.wireName().equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw ValidationException.invalidConfig("Unknown export_format '" + value + "', expected html, markdown or json");
    }
}
