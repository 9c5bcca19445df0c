package com.farmerworking.datyl.in.java.report;

public enum Severity {
    INFO,
    WARN,
    ERROR
}
