package com.searchnav.insights.analytics;

public class AuditNotFoundException extends RuntimeException {

    private final String auditId;

    public AuditNotFoundException(String auditId) {
        super("Audit result not found: " + auditId);
        this.auditId = auditId;
    }

    public AuditNotFoundException(String auditId, Throwable cause) {
        super("Audit result could not be fetched: " + auditId, cause);
        this.auditId = auditId;
    }

    public String getAuditId() {
        return auditId;
    }
}
