package com.pyformatter.rules;

import java.util.List;

import com.pyformatter.model.SourceModel;

/**
 * A rewrite rule. Implementations are stateless after construction and only produce
 * edits touching whitespace, parentheses or standalone marker lines of the role they own.
 */
public interface StyleRule {
    RuleId getId();

    /**
     * Computes the edits this rule wants for the given pass; an empty list when the
     * source already conforms.
     */
    List<Edit> apply(SourceModel source);
}
