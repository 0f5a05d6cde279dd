package com.wordlearena.orchestrator.report;

/** COMPLETED ran every planned round; STOPPED was cut short by an operator stop. */
public enum ReportStatus {
    COMPLETED,
    STOPPED
}
