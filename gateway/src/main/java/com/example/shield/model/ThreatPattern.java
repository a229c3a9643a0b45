package com.example.shield.model;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * One row of the detector's pattern table.
 */
public record ThreatPattern(String name, ThreatCategory category, Pattern pattern, Set<ScanTarget> targets) {

    public static ThreatPattern of(String name, ThreatCategory category, String regex, ScanTarget... targets) {
        return new ThreatPattern(name, category,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE), Set.of(targets));
    }

    public Severity severity() {
        return category.getSeverity();
    }

    public boolean appliesTo(ScanTarget target) {
        return targets.contains(target);
    }

    public boolean matches(String input) {
        return input != null && pattern.matcher(input).find();
    }
}
