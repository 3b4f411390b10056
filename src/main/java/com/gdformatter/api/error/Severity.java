package com.gdformatter.api.error;

public enum Severity {
    FATAL,   // the source does not parse, nothing was formatted
    ERROR,   // a safety check failed, the file is left untouched
    WARNING, // formatted, but something deserves a look
    INFO;    // advisory, e.g. lines longer than the configured limit

    /**
     * True for severities that leave the file unformatted.
     */
    public boolean isBlocking() {
        return this == FATAL || this == ERROR;
    }
}
