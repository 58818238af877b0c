package com.pyformatter.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;
import com.pyformatter.model.BlockKind;
import com.pyformatter.rules.RuleId;
import com.pyformatter.util.LoggerUtil;

/**
 * The resolved set of enabled rules handed to the formatting core.
 *
 * <p>Resolution: a non-empty enabled list replaces {@link #DEFAULT_RULES}, an empty or
 * missing one keeps them; the disabled list is then removed and always wins. Unknown
 * identifiers are reported as warnings, never as errors. Reserved identifiers such as
 * {@code typehint_spacing} are accepted and have no effect.
 */
public final class RuleConfig {
    private static final Logger logger = LoggerUtil.getLogger(RuleConfig.class);

    /**
     * Rules enabled when no enabled list is configured: every non-reserved rule.
     */
    public static final List<RuleId> DEFAULT_RULES = List.of(
            RuleId.IF_PARENTHESES,
            RuleId.BOOLEAN_SPACING,
            RuleId.RETURN_PARENTHESES,
            RuleId.BLOCK_END_MARKER,
            RuleId.ALIGN_ASSIGNMENTS,
            RuleId.ALIGN_IMPORTS,
            RuleId.ALIGN_DICT_COLONS);

    /**
     * Block chains closed by {@code block_end_marker} unless configured otherwise.
     */
    public static final Set<BlockKind> DEFAULT_MARKED_BLOCKS = Collections.unmodifiableSet(EnumSet.of(
            BlockKind.IF, BlockKind.FOR, BlockKind.WHILE, BlockKind.DEF, BlockKind.CLASS));

    private final Set<RuleId> enabledRules;
    private final Set<BlockKind> markedBlocks;
    private final List<FormatterError> warnings;

    private RuleConfig(Set<RuleId> enabledRules, Set<BlockKind> markedBlocks, List<FormatterError> warnings) {
        this.enabledRules = Collections.unmodifiableSet(enabledRules);
        this.markedBlocks = Collections.unmodifiableSet(markedBlocks);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public static RuleConfig defaults() {
        return resolve(List.of(), List.of());
    }

    /**
     * Enables exactly the given rules, with the default marked block kinds.
     */
    public static RuleConfig of(RuleId... rules) {
        Set<RuleId> enabled = EnumSet.noneOf(RuleId.class);
        Collections.addAll(enabled, rules);
        return new RuleConfig(enabled, EnumSet.copyOf(DEFAULT_MARKED_BLOCKS), new ArrayList<>());
    }

    public static RuleConfig resolve(List<String> enabledRules, List<String> disabledRules) {
        return resolve(enabledRules, disabledRules, null);
    }

    /**
     * Resolves rule identifier lists as read from configuration.
     *
     * @param enabledRules  rule identifiers to enable; null or empty keeps the defaults
     * @param disabledRules rule identifiers to disable; wins over {@code enabledRules}
     * @param markedBlocks  block kinds closed by end markers; null keeps the defaults
     */
    public static RuleConfig resolve(List<String> enabledRules, List<String> disabledRules,
                                     Collection<String> markedBlocks) {
        List<FormatterError> warnings = new ArrayList<>();

        Set<RuleId> enabled = EnumSet.noneOf(RuleId.class);
        if (enabledRules == null || enabledRules.isEmpty()) {
            enabled.addAll(DEFAULT_RULES);
        } else {
            enabled.addAll(_parseRules(enabledRules, "enabled", warnings));
        }
        if (disabledRules != null) {
            enabled.removeAll(_parseRules(disabledRules, "disabled", warnings));
        }

        Set<BlockKind> kinds = markedBlocks == null
                ? EnumSet.copyOf(DEFAULT_MARKED_BLOCKS)
                : _parseBlockKinds(markedBlocks, warnings);

        return new RuleConfig(enabled, kinds, warnings);
    }

    private static List<RuleId> _parseRules(List<String> keys, String listName, List<FormatterError> warnings) {
        List<RuleId> rules = new ArrayList<>();
        for (String key : keys) {
            Optional<RuleId> rule = RuleId.fromKey(key);
            if (rule.isPresent()) {
                rules.add(rule.get());
                if (rule.get().isReserved()) {
                    logger.fine("Rule '" + key + "' is reserved and currently has no effect");
                }
            } else {
                logger.warning("Ignoring unknown rule identifier in " + listName + " rules: " + key);
                warnings.add(new FormatterError(Severity.WARNING,
                        "Unknown rule identifier '" + key + "' in " + listName + " rules", 0, 0,
                        "Known rules: " + _knownKeys()));
            }
        }
        return rules;
    }

    private static Set<BlockKind> _parseBlockKinds(Collection<String> keys, List<FormatterError> warnings) {
        Set<BlockKind> kinds = EnumSet.noneOf(BlockKind.class);
        for (String key : keys) {
            BlockKind kind = key == null ? null : BlockKind.fromConfigKey(key);
            if (kind == null || kind == BlockKind.MODULE || kind.isContinuation()) {
                logger.warning("Ignoring block kind that cannot carry an end marker: " + key);
                warnings.add(new FormatterError(Severity.WARNING,
                        "Block kind '" + key + "' cannot carry an end marker", 0, 0,
                        "Use one of: if, for, while, def, class, try, with, other"));
                continue;
            }
            kinds.add(kind);
        }
        return kinds;
    }

    private static String _knownKeys() {
        List<String> keys = new ArrayList<>();
        for (RuleId id : RuleId.values()) {
            keys.add(id.getKey());
        }
        return String.join(", ", keys);
    }

    public boolean isEnabled(RuleId rule) {
        return enabledRules.contains(rule);
    }

    public Set<RuleId> getEnabledRules() {
        return enabledRules;
    }

    public Set<BlockKind> getMarkedBlocks() {
        return markedBlocks;
    }

    /**
     * Non-fatal problems found while resolving, such as unknown rule identifiers.
     */
    public List<FormatterError> getWarnings() {
        return warnings;
    }

    /**
     * A copy with a different set of block kinds closed by end markers.
     */
    public RuleConfig withMarkedBlocks(Set<BlockKind> kinds) {
        Set<BlockKind> copy = EnumSet.noneOf(BlockKind.class);
        copy.addAll(kinds);
        Set<RuleId> rules = EnumSet.noneOf(RuleId.class);
        rules.addAll(enabledRules);
        return new RuleConfig(rules, copy, new ArrayList<>(warnings));
    }

    @Override
    public String toString() {
        return "RuleConfig" + enabledRules;
    }
}
