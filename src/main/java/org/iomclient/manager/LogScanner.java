package org.iomclient.manager;

/**
 * Reads values and errors back out of log text.
 */
final class LogScanner {

    private LogScanner() {
    }

    /**
     * Text following {@code key} on the first log line that starts with it.
     * Echoed source lines start with a line number and never match.
     *
     * @return the trimmed value, or null if no line carries the key
     */
    static String valueOf(String log, String key) {
        for (String line : log.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith(key)) {
                return trimmed.substring(key.length()).trim();
            }
        }
        return null;
    }

    /**
     * First line reporting an error, or null.
     */
    static String firstError(String log) {
        for (String line : log.split("\\R")) {
            if (line.startsWith("ERROR")) {
                return line;
            }
        }
        return null;
    }
}
