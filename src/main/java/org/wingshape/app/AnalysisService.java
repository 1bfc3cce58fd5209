package org.wingshape.app;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wingshape.config.AnalysisConfig;
import org.wingshape.contour.Contour;
import org.wingshape.contour.ContourSynthesizer;
import org.wingshape.diagnostics.Diagnostic;
import org.wingshape.io.CoefficientSource;
import org.wingshape.io.csv.CsvCoefficientSource;
import org.wingshape.io.csv.CsvReportWriter;
import org.wingshape.io.json.PercentageJsonWriter;
import org.wingshape.model.CoefficientStore;
import org.wingshape.model.GroupKey;
import org.wingshape.model.Specimen;
import org.wingshape.normalize.NormalizedDataset;
import org.wingshape.normalize.SizeNormalizer;
import org.wingshape.variance.ConfigurationResult;
import org.wingshape.variance.DesignMatrix;
import org.wingshape.variance.DesignMatrixBuilder;
import org.wingshape.variance.PercentageTable;
import org.wingshape.variance.PrincipalComponents;
import org.wingshape.variance.SensitivityAnalysis;
import org.wingshape.variance.TypeIIIDecomposer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Default application service: CoefficientSource -> SizeNormalizer -> (contours | variance). */
public final class AnalysisService implements AnalysisUseCases {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisConfig config;
    private final CoefficientSource source;
    private final SizeNormalizer normalizer;
    private final ContourSynthesizer synthesizer = new ContourSynthesizer();
    private final CsvReportWriter csvWriter = new CsvReportWriter();
    private final PercentageJsonWriter jsonWriter = new PercentageJsonWriter();

    // Computed on first use
    private NormalizedDataset normalized;
    private DesignMatrix design;
    private List<ConfigurationResult> decompositions;
    private PrincipalComponents pca;

    public AnalysisService(AnalysisConfig config) {
        this(config, CsvCoefficientSource.ofFile(
                Objects.requireNonNull(config, "config must not be null").input(),
                config.csvFormat(),
                config.layout()));
    }

    public AnalysisService(AnalysisConfig config, CoefficientSource source) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        if (!source.layout().equals(config.layout())) {
            throw new IllegalArgumentException(
                    "Source layout " + source.layout() + " does not match configured layout " + config.layout()
            );
        }
        this.normalizer = new SizeNormalizer(config.parallel());
    }

    public AnalysisConfig config() {
        return config;
    }

    @Override
    public CoefficientStore specimens() {
        return source.load();
    }

    @Override
    public synchronized NormalizedDataset normalized() {
        if (normalized == null) {
            normalized = normalizer.normalizeAll(specimens());
        }
        return normalized;
    }

    @Override
    public Contour contour(String id, boolean normalizedCoefficients) {
        Objects.requireNonNull(id, "id must not be null");
        CoefficientStore store = normalizedCoefficients ? normalized().store() : specimens();
        Specimen s = store.require(id);
        return synthesizer.reconstruct(s.coefficients(), config.contourPoints());
    }

    @Override
    public Map<GroupKey, Contour> groupMeanContours() {
        return synthesizer.groupMeanContours(normalized().store(), config.contourPoints());
    }

    @Override
    public synchronized DesignMatrix designMatrix() {
        if (design == null) {
            CoefficientStore store = specimens();
            design = new DesignMatrixBuilder(config.coding()).build(store.speciesLabels(), store.sexLabels());
        }
        return design;
    }

    @Override
    public synchronized List<ConfigurationResult> decompositions() {
        if (decompositions == null) {
            TypeIIIDecomposer decomposer = new TypeIIIDecomposer(designMatrix());
            SensitivityAnalysis analysis = new SensitivityAnalysis(decomposer, config.parallel());
            decompositions = analysis.run(normalizedResponse(), config.pcCounts());
            for (ConfigurationResult r : decompositions) {
                if (r.sscp().rankDeficient()) {
                    log.warn("Configuration '{}': design rank {} < {}; results use the pseudo-inverse",
                            r.label(), r.sscp().rank(), r.sscp().expectedRank());
                }
            }
        }
        return decompositions;
    }

    @Override
    public PercentageTable percentageTable() {
        return PercentageTable.of(decompositions());
    }

    @Override
    public synchronized RealMatrix principalComponentScores(int k) {
        if (pca == null) {
            pca = PrincipalComponents.fit(PrincipalComponents.standardize(normalizedResponse()));
        }
        return pca.scores(Math.min(k, pca.componentCount()));
    }

    @Override
    public AnalysisReport run() throws IOException {
        log.info("Analysis of {} started", source.description());
        List<Path> written = new ArrayList<>();

        NormalizedDataset dataset = normalized();
        if (source instanceof CsvCoefficientSource csv) {
            csvWriter.writeNormalized(config.normalizedOutput(), csv.table(), dataset.store());
        } else {
            csvWriter.writeNormalized(config.normalizedOutput(), dataset.store(), config.csvFormat());
        }
        written.add(config.normalizedOutput());

        PercentageTable table = percentageTable();
        csvWriter.writePercentages(config.percentOutput(), table);
        written.add(config.percentOutput());
        Path json = siblingJson(config.percentOutput());
        jsonWriter.write(json, table);
        written.add(json);

        if (config.pcScoresOutput() != null) {
            csvWriter.writeScores(config.pcScoresOutput(), dataset.store(), principalComponentScores(3));
            written.add(config.pcScoresOutput());
        }

        List<Diagnostic> diagnostics = new ArrayList<>(dataset.diagnostics());
        for (ConfigurationResult r : decompositions()) {
            diagnostics.addAll(r.sscp().diagnostics());
        }

        log.info("Analysis finished: {} specimens, {} configurations, {} numeric conditions",
                dataset.store().size(), table.configurations().size(), diagnostics.size());
        return new AnalysisReport(dataset.store().size(), table, diagnostics, written);
    }

    private RealMatrix normalizedResponse() {
        return new Array2DRowRealMatrix(normalized().store().matrix().toArray(), false);
    }

    static Path siblingJson(Path csv) {
        String name = csv.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return csv.resolveSibling(stem + ".json");
    }
}
