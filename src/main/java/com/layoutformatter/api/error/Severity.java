package com.layoutformatter.api.error;

public enum Severity {
    FATAL,   // Internal invariant violated, no output produced
    ERROR,   // Output produced but a correction could not be applied
    WARNING, // Suspicious input that was formatted anyway
    INFO     // Informational messages about formatting
}
