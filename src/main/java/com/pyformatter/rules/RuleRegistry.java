package com.pyformatter.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.pyformatter.config.RuleConfig;
import com.pyformatter.model.SourceModel;
import com.pyformatter.rules.alignment.AssignmentAlignmentRule;
import com.pyformatter.rules.alignment.DictColonAlignmentRule;
import com.pyformatter.rules.alignment.ImportAlignmentRule;
import com.pyformatter.util.LoggerUtil;

/**
 * Rule instances for one {@link RuleConfig}, keyed by identifier and built once.
 * Rules hold no per-file state, so a registry may be shared by concurrent passes.
 */
public class RuleRegistry {
    private static final Logger logger = LoggerUtil.getLogger(RuleRegistry.class);

    private final Map<RuleId, StyleRule> rules;

    private RuleRegistry(Map<RuleId, StyleRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static RuleRegistry create(RuleConfig config) {
        Map<RuleId, StyleRule> rules = new EnumMap<>(RuleId.class);
        for (RuleId id : config.getEnabledRules()) {
            StyleRule rule = _instantiate(id, config);
            if (rule != null) {
                rules.put(id, rule);
            }
        }
        logger.fine("Rule registry created with rules " + rules.keySet());
        return new RuleRegistry(rules);
    }

    private static StyleRule _instantiate(RuleId id, RuleConfig config) {
        return switch (id) {
            case IF_PARENTHESES -> new IfParenthesesRule();
            case BOOLEAN_SPACING -> new BooleanSpacingRule();
            case RETURN_PARENTHESES -> new ReturnParenthesesRule();
            case BLOCK_END_MARKER -> new BlockEndMarkerRule(config.getMarkedBlocks());
            case ALIGN_ASSIGNMENTS -> new AssignmentAlignmentRule();
            case ALIGN_IMPORTS -> new ImportAlignmentRule();
            case ALIGN_DICT_COLONS -> new DictColonAlignmentRule();
            case TYPEHINT_SPACING -> null;
        };
    }

    /**
     * Active rules in catalogue order.
     */
    public List<StyleRule> getRules() {
        return new ArrayList<>(rules.values());
    }

    public boolean isActive(RuleId id) {
        return rules.containsKey(id);
    }

    /**
     * Runs every active rule over the model and returns all edits in source order.
     */
    public List<Edit> collectEdits(SourceModel source) {
        List<Edit> edits = new ArrayList<>();
        for (StyleRule rule : rules.values()) {
            List<Edit> ruleEdits = rule.apply(source);
            if (!ruleEdits.isEmpty()) {
                logger.finer(() -> rule.getId() + " produced " + ruleEdits.size() + " edits");
            }
            edits.addAll(ruleEdits);
        }
        edits.sort(Edit.SOURCE_ORDER);
        return edits;
    }
}
