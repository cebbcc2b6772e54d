package com.vuong.pgconnect.util;

import com.vuong.pgconnect.exception.ErrorCode;
import com.vuong.pgconnect.exception.QueryException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks 1-based pagination arguments.
 * Repositories only report the problems. A negative offset reads from the first row and a
 * negative size reads without a limit.
 */
public final class PaginationValidator {

    private PaginationValidator() {
    }

    /**
     * Validates the pagination parameters (page and size).
     * @param page the 1-based page number
     * @param size the page size
     * @return list of validation messages, empty if parameters are valid
     */
    public static List<String> validate(int page, int size) {
        List<String> errors = new ArrayList<>();
        if (page < 1) {
            errors.add("Page number must be at least 1, got " + page + " (offset " + offset(page, size) + ")");
        }
        if (size <= 0) {
            errors.add("Page size must be positive, got " + size);
        }
        return errors;
    }

    /**
     * Computes the row offset of a 1-based page.
     * @param page the 1-based page number
     * @param size the page size
     * @return {@code (page - 1) * size}, negative when page is below 1
     */
    public static long offset(int page, int size) {
        return ((long) page - 1) * size;
    }

    /**
     * Computes the first row to read for a 1-based page.
     * @param page the 1-based page number
     * @param size the page size
     * @return the offset, or 0 when the offset is negative
     * @throws QueryException if the offset does not fit in an int
     */
    public static int firstResult(int page, int size) {
        long offset = offset(page, size);
        if (offset > Integer.MAX_VALUE) {
            throw new QueryException(ErrorCode.INVALID_OPERATION,
                    "Page " + page + " of size " + size + " starts at row " + offset + ", beyond " + Integer.MAX_VALUE, null);
        }
        return (int) Math.max(0, offset);
    }
}
