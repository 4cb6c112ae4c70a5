

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

import ij.IJ;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.AbstractSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.MultiDirectionalSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.PowellOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.util.ResizableDoubleArray;

import java.text.DecimalFormat;
import java.util.Map;

/**
 * Myopic estimation of a Zernike transfer function and a power-law object prior from the power
 * spectrum of a single image, by minimisation of the {@link GeneralisedLikelihood} criterion.
 * <br><br>
 * The estimator holds no state between fits apart from the shared polynomial cache of its
 * {@link ZernikePolynomials}, so one instance can serve many images.
 */
class MyopicEstimator {

    /** Cost given to trial points where the criterion is undefined */
    static final double ILL_POSED_PENALTY = Double.MAX_VALUE;

    private final ZernikePolynomials zernike;

    private boolean log_results = true;


    MyopicEstimator(ZernikePolynomials zernike) {
        this.zernike = zernike;
    }


    /** Method to enable or disable writing to the ImageJ log
     *
     * @param log_condition Boolean value to set logging on or off
     */
    void setLogging(boolean log_condition) {
        this.log_results = log_condition;
    }


    /**
     * Method to estimate the parameters from an image: the power spectrum of the image
     * (normalised to a maximum of one) is calculated first.
     *
     * @param image Image values indexed [x][y], power-of-two dimensions
     * @see #fit(double[][], ZernikeModeSet, Map, boolean, OptimizerOptions, CostObserver)
     */
    GML_result estimate(double[][] image, ZernikeModeSet modes, Map<String, Double> initial_guess,
                        boolean fit_resolution, OptimizerOptions options) {
        return fit(PowerSpectrum.calculate(image, true), modes, initial_guess, fit_resolution, options, null);
    }


    /**
     * Method to fit the prior and transfer function parameters to a power spectrum.
     *
     * @param psd Power spectral density, zero frequency at the centre
     * @param modes The Zernike modes whose amplitudes are estimated, in the order they are reported
     * @param initial_guess Starting values overriding the defaults key by key (see
     *                      {@link MyopicParameters#merge(Map)}); may be null
     * @param fit_resolution Whether the resolution is estimated; if not it stays at its starting value
     * @param options Optimiser settings; null for the defaults
     * @param observer Notified of every evaluation; may be null
     * @return The fitted parameters, the convergence flag and the cost of every evaluation.
     *         Running out of evaluations or iterations is reported through the flag, with the
     *         best point found so far.
     * @throws NotStrictlyPositiveException if the spectrum has no rows or columns
     * @throws IllPosedObjectiveException if the criterion was undefined at every trial point
     */
    GML_result fit(double[][] psd, ZernikeModeSet modes, Map<String, Double> initial_guess,
                   boolean fit_resolution, OptimizerOptions options, CostObserver observer) {
        if (options == null) options = new OptimizerOptions();

        MyopicParameters initial = MyopicParameters.defaults(modes).merge(initial_guess);
        FrequencyGrid grid = FrequencyGrid.build(psd.length, psd.length == 0 ? 0 : psd[0].length);
        GeneralisedLikelihood gml = new GeneralisedLikelihood(psd, grid, modes, this.zernike);

        GML_function objective = new GML_function(gml, initial, fit_resolution, observer);
        double[] start = initial.toArray(fit_resolution);

        GML_result result = new GML_result();
        try {
            PointValuePair optimum = minimise(objective, start, options);
            result.params = initial.fromArray(optimum.getPoint(), fit_resolution);
            result.final_cost = optimum.getValue();
            result.converged = true;
        }
        catch (TooManyEvaluationsException | TooManyIterationsException e) {
            result.params = initial.fromArray(objective.best_point, fit_resolution);
            result.final_cost = objective.best_cost;
            result.converged = false;
            if (this.log_results) {
                IJ.log("Myopic estimation did not converge after " + objective.trace.getNumElements()
                        + " evaluations (" + e.getMessage() + "), keeping the best point found");
            }
        }
        if (objective.best_cost >= ILL_POSED_PENALTY) {
            throw new IllPosedObjectiveException(MyopicFormats.NO_DEFINED_COST, objective.trace.getNumElements());
        }
        result.cost_trace = objective.trace.getElements();

        if (this.log_results) {
            // DecimalFormat is not thread safe
            DecimalFormat sci = new DecimalFormat("0.0000E0");
            IJ.log("Myopic estimation: " + result.cost_trace.length + " evaluations, GML "
                    + sci.format(result.final_cost) + ", " + result.params);
        }
        return result;
    }


    /** Method to return the normalised transfer function of fitted parameters on an nx by ny grid */
    double[][] transferFunction(MyopicParameters params, int nx, int ny) {
        FrequencyGrid grid = FrequencyGrid.build(nx, ny);
        return new ZernikeTransferFunction(this.zernike).evaluate(grid.getRho(), grid.getPhi(),
                ZernikeTransferFunction.pupilFromResolution(params.getResolution()),
                params.amplitudesWithPiston(), params.getModes().withPiston());
    }


    private PointValuePair minimise(GML_function objective, double[] start, OptimizerOptions options) {
        MaxEval max_eval = new MaxEval(options.getMaxEvaluations());
        MaxIter max_iter = new MaxIter(options.getMaxIterations());

        if (options.getMethod() == OptimizerOptions.Method.POWELL) {
            PowellOptimizer optimizer = new PowellOptimizer(options.getRelativeTolerance(), options.getAbsoluteTolerance());
            return optimizer.optimize(max_eval, max_iter, new ObjectiveFunction(objective),
                    GoalType.MINIMIZE, new InitialGuess(start));
        }

        AbstractSimplex simplex;
        if (options.getMethod() == OptimizerOptions.Method.MULTI_DIRECTIONAL) {
            simplex = new MultiDirectionalSimplex(options.simplexSteps(start));
        }
        else {
            simplex = new NelderMeadSimplex(options.simplexSteps(start));
        }

        SimplexOptimizer optimizer = new SimplexOptimizer(
                new SimpleValueChecker(options.getRelativeTolerance(), options.getAbsoluteTolerance()));
        return optimizer.optimize(max_eval, max_iter, new ObjectiveFunction(objective),
                GoalType.MINIMIZE, new InitialGuess(start), simplex);
    }


    /**
     * The criterion as a function of the flat parameter vector the optimiser works on. Keeps the
     * cost of every evaluation and the best point seen, so that a fit that runs out of budget can
     * still report where it got to.
     */
    private static class GML_function implements MultivariateFunction {
        private final GeneralisedLikelihood gml;
        private final MyopicParameters initial;
        private final boolean fit_resolution;
        private final CostObserver observer;

        private final ResizableDoubleArray trace = new ResizableDoubleArray();
        private double[] best_point;
        private double best_cost = Double.POSITIVE_INFINITY;

        GML_function(GeneralisedLikelihood gml, MyopicParameters initial, boolean fit_resolution, CostObserver observer) {
            this.gml = gml;
            this.initial = initial;
            this.fit_resolution = fit_resolution;
            this.observer = observer;
            this.best_point = initial.toArray(fit_resolution);
        }

        public double value(double[] point) {
            MyopicParameters trial = this.initial.fromArray(point, this.fit_resolution);
            double cost = costOf(trial);

            this.trace.addElement(cost);
            if (cost < this.best_cost) {
                this.best_cost = cost;
                this.best_point = point.clone();
            }
            if (this.observer != null) {
                this.observer.costEvaluated(this.trace.getNumElements(), trial, cost);
            }
            return cost;
        }

        private double costOf(MyopicParameters trial) {
            try {
                return this.gml.cost(trial);
            }
            catch (IllPosedObjectiveException e) {
                return ILL_POSED_PENALTY;
            }
        }
    }


    /**
     * Definition of a GML_result class used to store the outcome of a fit
     */
    static class GML_result {
        MyopicParameters params;
        boolean converged;
        double[] cost_trace;
        double final_cost;

        /** Method to return the fitted parameters as a labelled map (alpha, beta, resolution, then one entry per mode) */
        Map<String, Double> asMap() {
            return this.params.asMap();
        }
    }
}
