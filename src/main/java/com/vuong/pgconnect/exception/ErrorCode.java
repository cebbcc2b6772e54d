package com.vuong.pgconnect.exception;

public enum ErrorCode {
    // Connection errors
    CONNECTION_ERROR("CONNECTION_ERROR", "Database connection failed"),
    CONNECTION_CLOSED("CONNECTION_CLOSED", "Database is closed"),

    // Schema errors
    MIGRATION_ERROR("MIGRATION_ERROR", "Schema migration failed"),

    // Data access errors
    ENTITY_NOT_FOUND("ENTITY_NOT_FOUND", "Entity not found"),
    QUERY_ERROR("QUERY_ERROR", "Query failed"),
    CONSTRAINT_VIOLATION("CONSTRAINT_VIOLATION", "Data constraint violation"),
    INVALID_OPERATION("INVALID_OPERATION", "Invalid operation");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
