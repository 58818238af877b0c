package com.pyformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CheckResult {
    private final boolean wouldChange;
    private final List<Violation> violations;

    public CheckResult(boolean wouldChange, List<Violation> violations) {
        this.wouldChange = wouldChange;
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public boolean wouldChange() { return wouldChange; }
    public List<Violation> getViolations() { return violations; }
}
