package com.dogfold.scaffold.codegen;

/**
 * Outcome categories of a generation flow and the marker each rendered message starts with.
 */
public enum ResultStatus {

    SUCCESS("✅"),
    WARNING("⚠️"),
    ERROR("❌");

    private final String marker;

    ResultStatus(String marker) {
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    /**
     * Exit status for a rendered outcome message: 0 when it carries the success or warning
     * marker, 1 otherwise.
     */
    public static int exitCodeOf(String renderedMessage) {
        if (renderedMessage != null
                && (renderedMessage.startsWith(SUCCESS.marker) || renderedMessage.startsWith(WARNING.marker))) {
            return 0;
        }
        return 1;
    }
}
