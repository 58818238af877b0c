package com.pyformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pyformatter.rules.Edit;

/**
 * Rendered text of one format pass and the edits that produced it.
 */
public class FormatOutcome {
    private final String renderedText;
    private final boolean changed;
    private final List<Edit> edits;

    public FormatOutcome(String renderedText, boolean changed, List<Edit> edits) {
        this.renderedText = renderedText;
        this.changed = changed;
        this.edits = Collections.unmodifiableList(new ArrayList<>(edits));
    }

    public String getRenderedText() { return renderedText; }
    public boolean isChanged() { return changed; }
    public List<Edit> getEdits() { return edits; }

    public List<Violation> getViolations() {
        List<Violation> violations = new ArrayList<>();
        for (Edit edit : edits) {
            violations.add(Violation.of(edit));
        }
        return violations;
    }
}
