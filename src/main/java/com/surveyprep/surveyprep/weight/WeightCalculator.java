package com.surveyprep.surveyprep.weight;

import com.surveyprep.surveyprep.pipeline.IssueKind;
import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.pipeline.RunIssues;
import com.surveyprep.surveyprep.pipeline.StructuralInputException;
import com.surveyprep.surveyprep.table.Cells;
import com.surveyprep.surveyprep.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-stratification weights: weight = target share of the respondent's stratum / observed share of that
 * stratum in the sample, optionally rescaled so weights sum to the number of weighted respondents.
 */
@Component
public class WeightCalculator {

    private static final Logger log = LoggerFactory.getLogger(WeightCalculator.class);

    /**
     * @throws StructuralInputException when the reference or a strata/population column is missing
     */
    public Table calculate(Table table, Table population, PipelineOptions options, RunIssues issues) {
        List<String> strata = options.strataColumns();
        validateInputs(table, population, strata, options.populationColumn());

        Map<StratumKey, Double> targets = targetShares(population, strata, options.populationColumn());

        Map<StratumKey, Integer> observed = new LinkedHashMap<>();
        List<StratumKey> respondentKeys = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            StratumKey key = StratumKey.of(table, r, strata);
            respondentKeys.add(key);
            observed.merge(key, 1, Integer::sum);
        }

        int n = table.rowCount();
        Map<StratumKey, Double> stratumWeights = new HashMap<>();
        observed.forEach((key, count) -> {
            Double target = targets.get(key);
            if (target == null) {
                issues.report(IssueKind.UNMATCHED_STRATUM, "Stratum " + key.describe(strata)
                        + " is not in the population reference; weight left unset for " + count + " respondent(s)", count);
                return;
            }
            stratumWeights.put(key, target * n / count);
        });

        List<Object> weights = new ArrayList<>(n);
        int matched = 0;
        double sum = 0.0d;
        for (StratumKey key : respondentKeys) {
            Double weight = stratumWeights.get(key);
            weights.add(weight);
            if (weight != null) {
                matched++;
                sum += weight;
            }
        }

        if (options.rescaleWeights() && matched > 0 && sum > 0.0d) {
            double factor = matched / sum;
            for (int r = 0; r < weights.size(); r++) {
                Object weight = weights.get(r);
                if (weight != null) {
                    weights.set(r, (Double) weight * factor);
                }
            }
        }

        Table.Builder builder = table.toBuilder();
        String weightColumn = options.weightColumn();
        if (builder.hasColumn(weightColumn)) {
            for (int r = 0; r < weights.size(); r++) {
                builder.set(r, weightColumn, weights.get(r));
            }
        } else {
            builder.addColumn(weightColumn, weights);
        }

        log.info("Weight calculation complete. respondents={}, weighted={}, strata={}, referenceStrata={}, rescaled={}",
                n, matched, observed.size(), targets.size(), options.rescaleWeights());
        return builder.build();
    }

    private void validateInputs(Table table, Table population, List<String> strata, String populationColumn) {
        if (population == null) {
            throw new StructuralInputException("Weight calculation requires a population reference table");
        }
        if (strata.isEmpty()) {
            throw new StructuralInputException("Weight calculation requires at least one strata column");
        }
        for (String column : strata) {
            if (!table.hasColumn(column)) {
                throw new StructuralInputException("Strata column " + column + " is not in the survey table");
            }
            if (!population.hasColumn(column)) {
                throw new StructuralInputException("Strata column " + column + " is not in the population reference");
            }
        }
        if (!population.hasColumn(populationColumn)) {
            throw new StructuralInputException("Population column " + populationColumn
                    + " is not in the population reference");
        }
    }

    /**
     * Reads reference targets, sums duplicate strata and normalizes to proportions. Rows with a blank,
     * non-numeric or non-positive target contribute nothing.
     */
    private Map<StratumKey, Double> targetShares(Table population, List<String> strata, String populationColumn) {
        Map<StratumKey, Double> totals = new LinkedHashMap<>();
        for (int r = 0; r < population.rowCount(); r++) {
            StratumKey key = StratumKey.of(population, r, strata);
            Double value = Cells.number(population.get(r, populationColumn));
            if (value == null || value <= 0.0d) {
                log.warn("Ignoring population reference row {} for stratum {}: target {} is not a positive number",
                        r + 1, key.describe(strata), Cells.text(population.get(r, populationColumn)));
                continue;
            }
            totals.merge(key, value, Double::sum);
        }

        double total = 0.0d;
        for (double value : totals.values()) {
            total += value;
        }
        Map<StratumKey, Double> shares = new LinkedHashMap<>();
        for (Map.Entry<StratumKey, Double> entry : totals.entrySet()) {
            shares.put(entry.getKey(), entry.getValue() / total);
        }
        return shares;
    }

    /**
     * Strata value tuple compared by matching keys.
     */
    record StratumKey(List<String> values) {

        static StratumKey of(Table table, int row, List<String> strata) {
            List<String> values = new ArrayList<>(strata.size());
            for (String column : strata) {
                values.add(Cells.key(table.get(row, column)));
            }
            return new StratumKey(List.copyOf(values));
        }

        String describe(List<String> strata) {
            Map<String, String> described = new LinkedHashMap<>();
            for (int i = 0; i < strata.size(); i++) {
                described.put(strata.get(i), values.get(i));
            }
            return described.toString();
        }
    }
}
