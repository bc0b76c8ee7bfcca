package com.surveyprep.surveyprep.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved survey structure, computed once per run and passed unchanged (or replaced, never mutated)
 * through the rest of the pipeline.
 *
 * @param mrSets       multi-response sets in declaration order
 * @param skipRules    resolved skip rules, one dependent column each, in evaluation order
 * @param labelPairs   code column name to its paired label column name
 * @param optionLabels multi-response member column to its human-readable option label
 */
public record SurveySchema(
        List<MrSet> mrSets,
        List<SkipRule> skipRules,
        Map<String, String> labelPairs,
        Map<String, String> optionLabels
) {

    public SurveySchema {
        mrSets = mrSets == null ? List.of() : List.copyOf(mrSets);
        skipRules = skipRules == null ? List.of() : List.copyOf(skipRules);
        labelPairs = labelPairs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labelPairs));
        optionLabels = optionLabels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(optionLabels));

        Set<String> names = new LinkedHashSet<>();
        Set<String> members = new LinkedHashSet<>();
        for (MrSet set : mrSets) {
            if (!names.add(set.name())) {
                throw new IllegalArgumentException("Duplicate multi-response set name: " + set.name());
            }
            for (String member : set.members()) {
                if (!members.add(member)) {
                    throw new IllegalArgumentException("Column " + member + " belongs to more than one multi-response set");
                }
            }
        }
    }

    public static SurveySchema empty() {
        return new SurveySchema(List.of(), List.of(), Map.of(), Map.of());
    }

    public Optional<MrSet> mrSet(String name) {
        return mrSets.stream().filter(set -> set.name().equals(name)).findFirst();
    }

    public Set<String> mrMembers() {
        Set<String> members = new LinkedHashSet<>();
        for (MrSet set : mrSets) {
            members.addAll(set.members());
        }
        return members;
    }

    public boolean isMrMember(String column) {
        for (MrSet set : mrSets) {
            if (set.members().contains(column)) {
                return true;
            }
        }
        return false;
    }

    public boolean isLabelColumn(String column) {
        return labelPairs.containsValue(column);
    }

    /**
     * Returns a copy with columns renamed everywhere they are referenced (set members, skip rules, label pairs,
     * option labels).
     */
    public SurveySchema withRenamedColumns(Map<String, String> renames) {
        if (renames.isEmpty()) {
            return this;
        }
        List<MrSet> renamedSets = new ArrayList<>(mrSets.size());
        for (MrSet set : mrSets) {
            List<String> members = new ArrayList<>(set.members().size());
            for (String member : set.members()) {
                members.add(renames.getOrDefault(member, member));
            }
            renamedSets.add(new MrSet(set.name(), members));
        }

        List<SkipRule> renamedRules = new ArrayList<>(skipRules.size());
        for (SkipRule rule : skipRules) {
            renamedRules.add(rule.renamed(renames));
        }

        Map<String, String> renamedPairs = new LinkedHashMap<>();
        labelPairs.forEach((code, text) -> renamedPairs.put(renames.getOrDefault(code, code), renames.getOrDefault(text, text)));

        Map<String, String> renamedLabels = new LinkedHashMap<>();
        optionLabels.forEach((member, label) -> renamedLabels.put(renames.getOrDefault(member, member), label));

        return new SurveySchema(renamedSets, renamedRules, renamedPairs, renamedLabels);
    }

    public SurveySchema withOptionLabels(Map<String, String> labels) {
        Map<String, String> merged = new HashMap<>(optionLabels);
        merged.putAll(labels);
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String member : mrMembers()) {
            if (merged.containsKey(member)) {
                ordered.put(member, merged.get(member));
            }
        }
        return new SurveySchema(mrSets, skipRules, labelPairs, ordered);
    }
}
