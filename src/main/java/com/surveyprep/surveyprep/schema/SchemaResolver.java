package com.surveyprep.surveyprep.schema;

import com.surveyprep.surveyprep.pipeline.IssueKind;
import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.pipeline.RunIssues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives the {@link SurveySchema} from column names: label pairs, multi-response sets (declared first, then
 * inferred from the {@code <prefix><separator><suffix>} naming convention) and declared skip rules.
 * No cell values are inspected.
 */
@Component
public class SchemaResolver {

    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    public SurveySchema resolve(List<String> columns, PipelineOptions options, RunIssues issues) {
        Map<String, String> labelPairs = detectLabelPairs(columns, options.labelSuffix());

        Set<String> excluded = new HashSet<>();
        excluded.add(options.idColumn());
        excluded.add(options.weightColumn());
        for (String column : columns) {
            if (column.endsWith(options.labelSuffix())) {
                excluded.add(column);
            }
        }

        Map<String, List<String>> sets = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        resolveDeclaredSets(columns, options, excluded, sets, claimed, issues);
        inferSets(columns, options, labelPairs, excluded, sets, claimed, issues);

        List<MrSet> mrSets = new ArrayList<>(sets.size());
        sets.forEach((name, members) -> mrSets.add(new MrSet(name, members)));
        mrSets.sort(Comparator.comparingInt(set -> columns.indexOf(set.members().get(0))));

        List<SkipRule> rules = resolveSkipRules(columns, options.skipRules(), sets, issues);

        log.info("Schema resolved. columns={}, mrSets={}, skipRules={}, labelPairs={}",
                columns.size(), mrSets.size(), rules.size(), labelPairs.size());
        return new SurveySchema(mrSets, rules, labelPairs, Map.of());
    }

    /**
     * Pairs each {@code C<suffix>} column with {@code C} when that code column exists.
     */
    static Map<String, String> detectLabelPairs(List<String> columns, String labelSuffix) {
        Set<String> present = new HashSet<>(columns);
        Map<String, String> pairs = new LinkedHashMap<>();
        for (String column : columns) {
            if (column.endsWith(labelSuffix) && column.length() > labelSuffix.length()) {
                String codeColumn = column.substring(0, column.length() - labelSuffix.length());
                if (present.contains(codeColumn)) {
                    pairs.put(codeColumn, column);
                }
            }
        }
        return pairs;
    }

    private void resolveDeclaredSets(List<String> columns, PipelineOptions options, Set<String> excluded,
                                     Map<String, List<String>> sets, Set<String> claimed, RunIssues issues) {
        Set<String> present = new HashSet<>(columns);
        options.declaredMrSets().forEach((name, declaredMembers) -> {
            List<String> members = new ArrayList<>();
            for (String member : declaredMembers) {
                if (!present.contains(member)) {
                    issues.report(IssueKind.SCHEMA_AMBIGUITY,
                            "Declared member " + member + " of set " + name + " is not in the table");
                } else if (excluded.contains(member) || claimed.contains(member) || members.contains(member)) {
                    issues.report(IssueKind.SCHEMA_AMBIGUITY,
                            "Declared member " + member + " of set " + name + " is already in use; left ungrouped");
                } else {
                    members.add(member);
                }
            }
            if (members.size() >= 2) {
                members.sort(Comparator.comparingInt(columns::indexOf));
                sets.put(name, members);
                claimed.addAll(members);
            } else {
                issues.report(IssueKind.SCHEMA_AMBIGUITY,
                        "Declared set " + name + " has fewer than 2 usable members; treated as single-response");
            }
        });
    }

    private void inferSets(List<String> columns, PipelineOptions options, Map<String, String> labelPairs,
                           Set<String> excluded, Map<String, List<String>> sets, Set<String> claimed,
                           RunIssues issues) {
        Pattern suffixPattern = Pattern.compile(options.mrSuffixPattern());
        String separator = options.mrSeparator();

        Map<String, List<String>> candidates = new LinkedHashMap<>();
        Map<String, List<String>> unparseable = new LinkedHashMap<>();
        for (String column : columns) {
            if (excluded.contains(column) || claimed.contains(column)) {
                continue;
            }
            if (options.mrRequiresLabelPair() && !labelPairs.containsKey(column)) {
                continue;
            }
            int split = column.lastIndexOf(separator);
            if (split <= 0 || split + separator.length() >= column.length()) {
                continue;
            }
            String prefix = column.substring(0, split);
            String suffix = column.substring(split + separator.length());
            if (suffixPattern.matcher(suffix).matches()) {
                candidates.computeIfAbsent(prefix, k -> new ArrayList<>()).add(column);
            } else {
                unparseable.computeIfAbsent(prefix, k -> new ArrayList<>()).add(column);
            }
        }

        Set<String> groupedPrefixes = new HashSet<>();
        candidates.forEach((prefix, members) -> {
            if (members.size() < 2) {
                return;
            }
            if (sets.containsKey(prefix)) {
                issues.report(IssueKind.SCHEMA_AMBIGUITY, "Columns " + members + " share the name of declared set "
                        + prefix + "; left ungrouped");
                return;
            }
            sets.put(prefix, members);
            claimed.addAll(members);
            groupedPrefixes.add(prefix);
        });

        unparseable.forEach((prefix, members) -> {
            if (groupedPrefixes.contains(prefix)) {
                for (String member : members) {
                    issues.report(IssueKind.SCHEMA_AMBIGUITY, "Column " + member + " matches set " + prefix
                            + " but its option suffix is not recognised; left ungrouped");
                }
            }
        });
    }

    private List<SkipRule> resolveSkipRules(List<String> columns, List<SkipRule> declared,
                                            Map<String, List<String>> sets, RunIssues issues) {
        Set<String> present = new HashSet<>(columns);
        List<SkipRule> expanded = new ArrayList<>();
        for (SkipRule rule : declared) {
            if (!present.contains(rule.gate())) {
                issues.report(IssueKind.UNRESOLVED_SKIP_GATE, "Gate column " + rule.gate() + " for "
                        + rule.dependent() + " is not in the table; no skip fill applied");
                continue;
            }
            if (sets.containsKey(rule.dependent())) {
                for (String member : sets.get(rule.dependent())) {
                    expanded.add(rule.withDependent(member));
                }
            } else if (present.contains(rule.dependent())) {
                expanded.add(rule);
            } else {
                issues.report(IssueKind.UNRESOLVED_SKIP_GATE, "Dependent " + rule.dependent()
                        + " gated by " + rule.gate() + " is not in the table; no skip fill applied");
            }
        }
        return orderByGateDependency(expanded, issues);
    }

    /**
     * Stable topological order: a rule that rewrites a column runs before any rule gated on that column, so
     * re-running the rules on their own output changes nothing.
     */
    private List<SkipRule> orderByGateDependency(List<SkipRule> rules, RunIssues issues) {
        List<SkipRule> remaining = new ArrayList<>(rules);
        List<SkipRule> ordered = new ArrayList<>(rules.size());
        while (!remaining.isEmpty()) {
            SkipRule next = null;
            for (SkipRule candidate : remaining) {
                boolean blocked = false;
                for (SkipRule other : remaining) {
                    if (other.dependent().equals(candidate.gate())) {
                        blocked = true;
                        break;
                    }
                }
                if (!blocked) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                for (SkipRule cyclic : remaining) {
                    issues.report(IssueKind.UNRESOLVED_SKIP_GATE, "Skip rule for " + cyclic.dependent()
                            + " gated by " + cyclic.gate() + " is in or behind a gate cycle; no skip fill applied");
                }
                break;
            }
            remaining.remove(next);
            ordered.add(next);
        }
        return ordered;
    }
}
