package com.pyformatter.rules;

import java.util.Optional;

/**
 * The fixed catalogue of rule identifiers.
 * Declaration order is the order in which same-offset insertions from different rules
 * are applied, so block end markers come after every in-line edit.
 */
public enum RuleId {
    IF_PARENTHESES("if_parentheses", false),
    BOOLEAN_SPACING("boolean_spacing", false),
    RETURN_PARENTHESES("return_parentheses", false),
    ALIGN_ASSIGNMENTS("align_assignments", false),
    ALIGN_IMPORTS("align_imports", false),
    ALIGN_DICT_COLONS("align_dict_colons", false),
    BLOCK_END_MARKER("block_end_marker", false),
    TYPEHINT_SPACING("typehint_spacing", true);

    private final String key;
    private final boolean reserved;

    RuleId(String key, boolean reserved) {
        this.key = key;
        this.reserved = reserved;
    }

    /**
     * Identifier used in configuration and reports.
     */
    public String getKey() {
        return key;
    }

    /**
     * Reserved identifiers are accepted in configuration but have no rule behind them yet.
     */
    public boolean isReserved() {
        return reserved;
    }

    public static Optional<RuleId> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim();
        for (RuleId id : values()) {
            if (id.key.equals(normalized)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return key;
    }
}
