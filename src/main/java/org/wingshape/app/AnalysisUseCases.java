package org.wingshape.app;

import org.apache.commons.math3.linear.RealMatrix;
import org.wingshape.contour.Contour;
import org.wingshape.model.CoefficientStore;
import org.wingshape.model.GroupKey;
import org.wingshape.normalize.NormalizedDataset;
import org.wingshape.variance.ConfigurationResult;
import org.wingshape.variance.DesignMatrix;
import org.wingshape.variance.PercentageTable;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Application boundary consumed by the command line and by reporting collaborators.
 * Keeps callers independent from the normalize/contour/variance packages' wiring.
 */
public interface AnalysisUseCases {

    /** Raw coefficients as loaded. */
    CoefficientStore specimens();

    /** Size-normalized copy of {@link #specimens()}. */
    NormalizedDataset normalized();

    /** Contour of one specimen, raw or normalized, at the configured sampling density. */
    Contour contour(String id, boolean normalized);

    /** Mean normalized contour per species x sex group. */
    Map<GroupKey, Contour> groupMeanContours();

    /** Design built from the loaded labels; shared by every decomposition. */
    DesignMatrix designMatrix();

    /** Type-III decomposition under every configured dimensionality setting. */
    List<ConfigurationResult> decompositions();

    PercentageTable percentageTable();

    /** Scores of the normalized, standardized coefficients on the first k principal components. */
    RealMatrix principalComponentScores(int k);

    /** Runs the batch pipeline and writes every configured output. */
    AnalysisReport run() throws IOException;
}
