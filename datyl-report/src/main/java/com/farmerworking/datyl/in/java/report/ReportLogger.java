package com.farmerworking.datyl.in.java.report;

// Sink for report lines that are logged as they are reported.
public interface ReportLogger {
    void log(Severity severity, String msg, String... args);
}
