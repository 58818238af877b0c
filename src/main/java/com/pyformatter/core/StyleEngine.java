package com.pyformatter.core;

import java.util.List;
import java.util.logging.Logger;

import com.pyformatter.api.CheckResult;
import com.pyformatter.api.FormatOutcome;
import com.pyformatter.api.error.FormattingException;
import com.pyformatter.config.RuleConfig;
import com.pyformatter.model.SourceModel;
import com.pyformatter.rules.Edit;
import com.pyformatter.rules.RuleRegistry;
import com.pyformatter.util.LoggerUtil;

/**
 * One formatting pass over a single text: parse, collect edits from the active rules,
 * render, verify. Holds no per-file state, so one engine may serve concurrent files.
 */
public class StyleEngine {
    private static final Logger logger = LoggerUtil.getLogger(StyleEngine.class);

    private final RuleRegistry registry;
    private final IdempotencyVerifier verifier;

    public StyleEngine(RuleConfig config) {
        this.registry = RuleRegistry.create(config);
        this.verifier = new IdempotencyVerifier(registry);
    }

    public static FormatOutcome format(String text, RuleConfig config) throws FormattingException {
        return new StyleEngine(config).format(text);
    }

    public static CheckResult check(String text, RuleConfig config) throws FormattingException {
        return new StyleEngine(config).check(text);
    }

    /**
     * Formats {@code text}. Either every edit is applied or, on failure, none.
     *
     * @throws FormattingException if the text cannot be tokenized or has inconsistent indentation
     * @throws com.pyformatter.api.error.InvariantViolationException if the rules misbehave
     */
    public FormatOutcome format(String text) throws FormattingException {
        SourceModel model = SourceModel.parse(text);
        List<Edit> edits = registry.collectEdits(model);
        String rendered = EditRenderer.render(text, edits);
        verifier.verify(rendered);

        logger.fine(() -> "Format pass: " + model.getLines().size() + " logical lines, " + edits.size() + " edits");
        return new FormatOutcome(rendered, !rendered.equals(text), edits);
    }

    /**
     * Reports what {@link #format(String)} would change, without returning the new text.
     */
    public CheckResult check(String text) throws FormattingException {
        FormatOutcome outcome = format(text);
        return new CheckResult(outcome.isChanged(), outcome.getViolations());
    }
}
