package com.surveyprep.surveyprep.schema;

import com.surveyprep.surveyprep.table.Cells;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Conditional-skip declaration: {@code dependent} only applies to respondents whose {@code gate} value is one
 * of {@code values}. Values are held as matching keys (see {@link Cells#key(Object)}).
 *
 * <p>In configuration the dependent may name a multi-response set; once resolved it is always a single column.</p>
 */
public record SkipRule(String dependent, String gate, Set<String> values) {

    public SkipRule {
        if (dependent == null || dependent.isBlank()) {
            throw new IllegalArgumentException("Skip rule dependent is required");
        }
        if (gate == null || gate.isBlank()) {
            throw new IllegalArgumentException("Skip rule gate is required");
        }
        Set<String> keys = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                keys.add(Cells.key(value));
            }
        }
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Skip rule for " + dependent + " needs at least one satisfying value");
        }
        values = Collections.unmodifiableSet(keys);
    }

    public static SkipRule of(String dependent, String gate, Collection<String> values) {
        return new SkipRule(dependent, gate, new LinkedHashSet<>(values));
    }

    public boolean isSatisfiedBy(Object gateValue) {
        return values.contains(Cells.key(gateValue));
    }

    SkipRule withDependent(String column) {
        return new SkipRule(column, gate, values);
    }

    SkipRule renamed(Map<String, String> renames) {
        return new SkipRule(renames.getOrDefault(dependent, dependent), renames.getOrDefault(gate, gate), values);
    }
}
