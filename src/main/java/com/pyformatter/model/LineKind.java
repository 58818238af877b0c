package com.pyformatter.model;

public enum LineKind {
    BLANK,   // only whitespace before the line break
    COMMENT, // a comment is the only content
    CODE     // holds at least one significant token
}
