package org.iomclient.cli;

/**
 * How the listing of a submission is produced.
 */
public enum OutputFormat {
    /**
     * Output captured to an HTML file in the work directory and read back.
     */
    HTML("html"),
    /**
     * Plain text listing drained from the listing buffer.
     */
    TEXT("text");

    private final String formatText;

    OutputFormat(String formatText) {
        this.formatText = formatText;
    }

    public String getFormatText() {
        return formatText;
    }

    public static OutputFormat of(String formatText) {
        for (OutputFormat format : values()) {
            if (format.formatText.equalsIgnoreCase(formatText)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + formatText
                + ". The allowed values are html, text.");
    }
}
