package com.pyformatter.core;

import java.util.List;
import java.util.logging.Logger;

import com.pyformatter.api.error.FormattingException;
import com.pyformatter.api.error.InvariantViolationException;
import com.pyformatter.model.SourceModel;
import com.pyformatter.rules.Edit;
import com.pyformatter.rules.RuleRegistry;
import com.pyformatter.util.LoggerUtil;

/**
 * Re-runs the rules over rendered output and fails if they still want to change it.
 */
public class IdempotencyVerifier {
    private static final Logger logger = LoggerUtil.getLogger(IdempotencyVerifier.class);

    private final RuleRegistry registry;

    public IdempotencyVerifier(RuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws InvariantViolationException if the rendered text does not parse or would be edited again
     */
    public void verify(String rendered) {
        SourceModel model;
        try {
            model = SourceModel.parse(rendered);
        } catch (FormattingException e) {
            throw new InvariantViolationException("Formatted output no longer parses: " + e.getMessage());
        }

        List<Edit> edits = registry.collectEdits(model);
        if (!edits.isEmpty()) {
            logger.warning("Second pass produced " + edits.size() + " edits, first: " + edits.get(0));
            throw new InvariantViolationException("Formatting is not idempotent: a second pass produced "
                    + edits.size() + " edits, first " + edits.get(0));
        }
    }
}
