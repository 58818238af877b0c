package com.pyformatter.api.error;

public enum Severity {
    FATAL,   // Lexing, indentation or invariant failures preventing formatting
    ERROR,   // Issues requiring manual intervention
    WARNING  // Configuration problems such as unknown rule identifiers
}
