package com.legalreview.extraction.model;

public enum AuditAction {
    CONFIRM,
    REJECT,
    MANUAL_EDIT
}
