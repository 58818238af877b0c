package com.pyformatter.model;

import java.util.List;
import java.util.Locale;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;

/**
 * Kind of a block, derived from the leading keyword of its header.
 */
public enum BlockKind {
    MODULE,
    IF,
    ELIF,
    ELSE,
    WHILE,
    FOR,
    DEF,
    CLASS,
    TRY,
    EXCEPT,
    FINALLY,
    WITH,
    OTHER;

    /**
     * Clauses that can only follow another block at the same indent.
     */
    public boolean isContinuation() {
        return this == ELIF || this == ELSE || this == EXCEPT || this == FINALLY;
    }

    /**
     * Lower-case name used in configuration files, e.g. {@code "for"}.
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BlockKind fromConfigKey(String key) {
        for (BlockKind kind : values()) {
            if (kind.configKey().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        return null;
    }

    public static BlockKind ofHeader(LogicalLine header) {
        List<Integer> indexes = header.getSignificantIndexes();
        if (indexes.isEmpty()) {
            return OTHER;
        }
        Token first = header.getTokens().get(indexes.get(0));
        if (!first.is(TokenKind.KEYWORD)) {
            return OTHER;
        }
        if (first.getText().equals("async") && indexes.size() > 1) {
            first = header.getTokens().get(indexes.get(1));
        }
        return switch (first.getText()) {
            case "if" -> IF;
            case "elif" -> ELIF;
            case "else" -> ELSE;
            case "while" -> WHILE;
            case "for" -> FOR;
            case "def" -> DEF;
            case "class" -> CLASS;
            case "try" -> TRY;
            case "except" -> EXCEPT;
            case "finally" -> FINALLY;
            case "with" -> WITH;
            default -> OTHER;
        };
    }
}
