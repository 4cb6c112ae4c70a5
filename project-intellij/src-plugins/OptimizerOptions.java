

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

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;

/**
 * Settings for the minimisation of the GML criterion. All methods are gradient free.
 */
final class OptimizerOptions {

    enum Method {
        /** Nelder-Mead simplex */
        NELDER_MEAD,
        /** Torczon's multi-directional simplex */
        MULTI_DIRECTIONAL,
        /** Powell's conjugate direction method */
        POWELL
    }

    static final int DEFAULT_MAX_EVALUATIONS = 20000;
    static final int DEFAULT_MAX_ITERATIONS = 10000;
    static final double DEFAULT_RELATIVE_TOLERANCE = 1e-10;
    static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-300;
    static final double DEFAULT_SIMPLEX_STEP = 0.1;
    static final double DEFAULT_MIN_SIMPLEX_STEP = 1e-3;

    // Lowest relative tolerance the Powell optimiser accepts
    private static final double MIN_RELATIVE_TOLERANCE = 2 * Math.ulp(1d);

    private Method method = Method.NELDER_MEAD;
    private int max_evaluations = DEFAULT_MAX_EVALUATIONS;
    private int max_iterations = DEFAULT_MAX_ITERATIONS;
    private double relative_tolerance = DEFAULT_RELATIVE_TOLERANCE;
    private double absolute_tolerance = DEFAULT_ABSOLUTE_TOLERANCE;
    private double simplex_step = DEFAULT_SIMPLEX_STEP;
    private double min_simplex_step = DEFAULT_MIN_SIMPLEX_STEP;


    OptimizerOptions setMethod(Method method) {
        this.method = method;
        return this;
    }

    /** Method to set the evaluation budget; exceeding it ends the fit without convergence */
    OptimizerOptions setMaxEvaluations(int max_evaluations) {
        if (max_evaluations <= 0) throw new NotStrictlyPositiveException(max_evaluations);
        this.max_evaluations = max_evaluations;
        return this;
    }

    /** Method to set the iteration budget; exceeding it ends the fit without convergence */
    OptimizerOptions setMaxIterations(int max_iterations) {
        if (max_iterations <= 0) throw new NotStrictlyPositiveException(max_iterations);
        this.max_iterations = max_iterations;
        return this;
    }

    /**
     * Method to set the convergence thresholds on the criterion value. The fit has converged
     * when successive values differ by less than relative * |value| or less than absolute.
     */
    OptimizerOptions setTolerances(double relative, double absolute) {
        if (relative < MIN_RELATIVE_TOLERANCE) throw new NumberIsTooSmallException(relative, MIN_RELATIVE_TOLERANCE, true);
        if (absolute <= 0) throw new NotStrictlyPositiveException(absolute);
        this.relative_tolerance = relative;
        this.absolute_tolerance = absolute;
        return this;
    }

    /**
     * Method to set the size of the initial simplex. Along each parameter the simplex extends
     * by step * |starting value|, and by at least min_step.
     */
    OptimizerOptions setSimplexStep(double step, double min_step) {
        if (step <= 0) throw new NotStrictlyPositiveException(step);
        if (min_step <= 0) throw new NotStrictlyPositiveException(min_step);
        this.simplex_step = step;
        this.min_simplex_step = min_step;
        return this;
    }


    /** Method to calculate the initial simplex steps for a starting point */
    double[] simplexSteps(double[] start) {
        double[] steps = new double[start.length];
        for (int i=0; i<start.length; i++) {
            steps[i] = Math.max(Math.abs(start[i]) * this.simplex_step, this.min_simplex_step);
        }
        return steps;
    }


    Method getMethod() { return this.method; }
    int getMaxEvaluations() { return this.max_evaluations; }
    int getMaxIterations() { return this.max_iterations; }
    double getRelativeTolerance() { return this.relative_tolerance; }
    double getAbsoluteTolerance() { return this.absolute_tolerance; }
    double getSimplexStep() { return this.simplex_step; }
    double getMinSimplexStep() { return this.min_simplex_step; }
}
