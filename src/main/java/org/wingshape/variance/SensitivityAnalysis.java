package org.wingshape.variance;

import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Repeats the Type-III decomposition under several dimensionality-reduction settings:
 * all standardized features first, then the first k principal components for each requested k.
 *
 * Configurations share only the decomposer (and with it the design), so they may run in
 * parallel; each one writes its own slot of a pre-sized result array.
 */
public final class SensitivityAnalysis {

    private static final Logger log = LoggerFactory.getLogger(SensitivityAnalysis.class);

    private final TypeIIIDecomposer decomposer;
    private final boolean parallel;

    public SensitivityAnalysis(TypeIIIDecomposer decomposer, boolean parallel) {
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer must not be null");
        this.parallel = parallel;
    }

    /**
     * @param raw samples x features (normalized coefficients), rows in design order
     * @param pcCounts numbers of retained components; values above the available count are clamped,
     *                 and a request that lands on an already included count is skipped so that
     *                 every configuration label is unique
     */
    public List<ConfigurationResult> run(RealMatrix raw, List<Integer> pcCounts) {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(pcCounts, "pcCounts must not be null");

        RealMatrix standardized = PrincipalComponents.standardize(raw);
        PrincipalComponents pca = PrincipalComponents.fit(standardized);

        List<Configuration> configurations = new ArrayList<>();
        configurations.add(new Configuration(
                "All Features (" + standardized.getColumnDimension() + ")", standardized));
        Set<Integer> produced = new HashSet<>();
        for (Integer requested : pcCounts) {
            if (requested == null || requested <= 0) {
                throw new IllegalArgumentException("pcCounts entries must be >= 1: " + pcCounts);
            }
            int k = Math.min(requested, pca.componentCount());
            if (k < requested) {
                log.warn("Requested {} PCs but only {} are available; using {}", requested, k, k);
            }
            if (!produced.add(k)) {
                log.warn("Skipping request for {} PCs: the {}-component configuration is already included",
                        requested, k);
                continue;
            }
            String label = String.format(Locale.ROOT, "%d PCs (%.1f%%)", k, pca.cumulativeRatio(k) * 100.0);
            configurations.add(new Configuration(label, pca.scores(k)));
        }

        ConfigurationResult[] slots = new ConfigurationResult[configurations.size()];
        IntStream indices = IntStream.range(0, slots.length);
        if (parallel) {
            indices = indices.parallel();
        }
        indices.forEach(i -> {
            Configuration c = configurations.get(i);
            SscpResult sscp = decomposer.decompose(c.response, c.label);
            slots[i] = new ConfigurationResult(c.label, c.response.getColumnDimension(), sscp);
            log.info("Decomposed configuration '{}' over {} dimensions", c.label, c.response.getColumnDimension());
        });
        return List.copyOf(Arrays.asList(slots));
    }

    private record Configuration(String label, RealMatrix response) { }
}
