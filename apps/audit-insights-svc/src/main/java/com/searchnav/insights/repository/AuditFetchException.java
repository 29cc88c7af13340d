package com.searchnav.insights.repository;

public class AuditFetchException extends RuntimeException {

    public AuditFetchException(String message) {
        super(message);
    }

    public AuditFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
