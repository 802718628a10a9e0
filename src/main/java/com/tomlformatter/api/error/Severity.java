package com.tomlformatter.api.error;

public enum Severity {
    FATAL,   // Document could not be formatted at all
    ERROR,   // Problems requiring manual intervention
    WARNING, // Document was formatted but something looked off
    INFO     // Informational messages about formatting
}
