package com.vuong.pgconnect.config;

/**
 * Verbosity of the SQL and operation logging done on behalf of the mapper.
 * Levels are ordered; a level enables everything at or below it.
 */
public enum LogLevel {
    /** No SQL or operation logging. */
    SILENT(1),
    /** Failed operations are logged at ERROR. */
    ERROR(2),
    /** Failed operations, plus slow operations at WARN. */
    WARN(3),
    /** Everything, including each SQL statement at INFO. */
    INFO(4);

    private final int severity;

    LogLevel(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Checks whether messages of the given level are emitted under this level.
     * @param level the level of the message
     * @return true if the message should be logged
     */
    public boolean isEnabled(LogLevel level) {
        return level != SILENT && severity >= level.severity;
    }
}
