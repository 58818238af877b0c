package com.pyformatter.rules.alignment;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.model.SourceModel;
import com.pyformatter.rules.Edit;
import com.pyformatter.rules.StyleRule;

/**
 * Base class of the alignment rules: subclasses turn the source into slot sequences,
 * grouping and padding are shared.
 */
public abstract class AlignmentRule implements StyleRule {

    /**
     * Independent slot sequences to scan for groups; null entries reset grouping.
     */
    protected abstract List<List<AlignmentCandidate>> candidateRuns(SourceModel source);

    /**
     * Separator text as shown in violation descriptions.
     */
    protected abstract String separatorName();

    @Override
    public List<Edit> apply(SourceModel source) {
        List<Edit> edits = new ArrayList<>();
        for (List<AlignmentCandidate> run : candidateRuns(source)) {
            for (AlignmentGroup group : AlignmentGroup.scan(run)) {
                edits.addAll(group.edits(getId(), separatorName()));
            }
        }
        return edits;
    }
}
