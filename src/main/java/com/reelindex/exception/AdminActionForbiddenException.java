package com.reelindex.exception;

/**
 * Raised by destructive admin endpoints while demo mode is on.
 */
public class AdminActionForbiddenException extends RuntimeException {

    public AdminActionForbiddenException() {
        super("Admin actions disabled in demo mode");
    }
}
