

/*
 * MIT License
 *
 * Copyright (c) 2019 David Platten
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MyopicEstimatorTest {

    private static final ZernikeModeSet MODES = ZernikeModeSet.ASTIGMATISM_AND_SPHERICAL;

    private final ZernikePolynomials zernike = new ZernikePolynomials();

    /** Spectrum for which the parameters of {@link GeneralisedLikelihoodTest#truth()} are optimal */
    private double[][] syntheticSpectrum() {
        GeneralisedLikelihood gml = new GeneralisedLikelihood(new double[32][32], FrequencyGrid.build(32, 32), MODES, this.zernike);
        return gml.expectedSpectrum(GeneralisedLikelihoodTest.truth());
    }

    private static Map<String, Double> nearbyGuess() {
        Map<String, Double> guess = new HashMap<>();
        guess.put(MyopicParameters.ALPHA, 1.02);
        guess.put(MyopicParameters.BETA, 2.04);
        guess.put(MyopicParameters.RESOLUTION, 2.04);
        guess.put("Z(2,-2)", 0.0102);
        guess.put("Z(2,2)", -0.0204);
        guess.put("Z(4,0)", 0.0306);
        return guess;
    }

    private static OptimizerOptions smallSteps(int max_evaluations) {
        return new OptimizerOptions()
                .setSimplexStep(0.005, 1e-5)
                .setTolerances(1e-12, 1e-300)
                .setMaxEvaluations(max_evaluations);
    }

    private MyopicEstimator quietEstimator() {
        MyopicEstimator estimator = new MyopicEstimator(this.zernike);
        estimator.setLogging(false);
        return estimator;
    }

    private static void assertWithin(double expected, double actual, double fraction, String name) {
        assertEquals(expected, actual, Math.abs(expected) * fraction, name);
    }

    @Test
    void recoversSyntheticParameters() {
        MyopicEstimator.GML_result result = quietEstimator().fit(syntheticSpectrum(), MODES, nearbyGuess(),
                true, smallSteps(5000), null);

        MyopicParameters truth = GeneralisedLikelihoodTest.truth();
        assertWithin(truth.getAlpha(), result.params.getAlpha(), 0.1, "alpha");
        assertWithin(truth.getBeta(), result.params.getBeta(), 0.1, "beta");
        assertWithin(truth.getResolution(), result.params.getResolution(), 0.1, "resolution");
        for (ZernikeMode mode : MODES) {
            assertWithin(truth.getAmplitude(mode), result.params.getAmplitude(mode), 0.1, mode.label());
        }
        assertTrue(result.final_cost <= result.cost_trace[0]);
    }

    @Test
    void fixedResolutionIsNotChanged() {
        MyopicEstimator.GML_result result = quietEstimator().fit(syntheticSpectrum(), MODES, nearbyGuess(),
                false, smallSteps(2000), null);
        assertEquals(2.04, result.params.getResolution(), 0.0);
    }

    @Test
    void repeatedFitsGiveIdenticalResults() {
        MyopicEstimator estimator = quietEstimator();
        double[][] psd = syntheticSpectrum();
        MyopicEstimator.GML_result first = estimator.fit(psd, MODES, nearbyGuess(), true, smallSteps(1000), null);
        MyopicEstimator.GML_result second = estimator.fit(psd, MODES, nearbyGuess(), true, smallSteps(1000), null);
        assertArrayEquals(first.params.toArray(true), second.params.toArray(true), 0.0);
        assertArrayEquals(first.cost_trace, second.cost_trace, 0.0);
    }

    @Test
    void exhaustedBudgetIsReportedWithTheBestPoint() {
        MyopicEstimator.GML_result result = quietEstimator().fit(syntheticSpectrum(), MODES, nearbyGuess(),
                true, new OptimizerOptions().setMaxEvaluations(8), null);

        assertFalse(result.converged);
        assertEquals(8, result.cost_trace.length);
        double lowest = Double.POSITIVE_INFINITY;
        for (double cost : result.cost_trace) lowest = Math.min(lowest, cost);
        assertEquals(lowest, result.final_cost, 0.0);
        assertNotNull(result.params);
    }

    @Test
    void observerSeesEveryEvaluation() {
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger last = new AtomicInteger();
        CostObserver observer = new CostObserver() {
            public void costEvaluated(int evaluation, MyopicParameters params, double cost) {
                calls.incrementAndGet();
                last.set(evaluation);
            }
        };
        MyopicEstimator.GML_result result = quietEstimator().fit(syntheticSpectrum(), MODES, nearbyGuess(),
                true, smallSteps(200), observer);
        assertEquals(result.cost_trace.length, calls.get());
        assertEquals(result.cost_trace.length, last.get());
    }

    @Test
    void fitWithNoDefinedCostIsAnError() {
        Map<String, Double> guess = nearbyGuess();
        guess.put(MyopicParameters.ALPHA, -400.0);
        final int[] evaluations = new int[1];
        CostObserver observer = new CostObserver() {
            public void costEvaluated(int evaluation, MyopicParameters params, double cost) {
                assertEquals(MyopicEstimator.ILL_POSED_PENALTY, cost, 0.0);
                evaluations[0] = evaluation;
            }
        };
        IllPosedObjectiveException e = assertThrows(IllPosedObjectiveException.class,
                () -> quietEstimator().fit(syntheticSpectrum(), MODES, guess, true,
                        new OptimizerOptions().setMaxEvaluations(100), observer));
        assertTrue(evaluations[0] > 0);
        assertTrue(e.getMessage().contains("undefined"));
    }

    @Test
    void emptySpectrumIsRejected() {
        assertThrows(NotStrictlyPositiveException.class, () -> quietEstimator().fit(new double[0][0], MODES,
                null, true, null, null));
        assertThrows(NotStrictlyPositiveException.class, () -> quietEstimator().fit(new double[4][0], MODES,
                null, true, null, null));
    }

    @Test
    void everyMethodImprovesOnTheStart() {
        OptimizerOptions.Method[] methods = {OptimizerOptions.Method.MULTI_DIRECTIONAL, OptimizerOptions.Method.POWELL};
        for (OptimizerOptions.Method method : methods) {
            MyopicEstimator.GML_result result = quietEstimator().fit(syntheticSpectrum(), MODES, nearbyGuess(),
                    true, smallSteps(500).setMethod(method), null);
            assertTrue(result.final_cost <= result.cost_trace[0], method.toString());
            assertTrue(result.cost_trace.length <= 500, method.toString());
        }
    }

    @Test
    void estimateRequiresPowerOfTwoImages() {
        assertThrows(MathIllegalArgumentException.class, () -> quietEstimator().estimate(new double[12][16], MODES,
                null, true, null));
    }

    @Test
    void transferFunctionOfFittedParameters() {
        double[][] otf = quietEstimator().transferFunction(GeneralisedLikelihoodTest.truth(), 16, 8);
        assertEquals(16, otf.length);
        assertEquals(8, otf[0].length);
        assertEquals(1.0, ArrayConversions.sum(otf), 1e-12);
    }
}
