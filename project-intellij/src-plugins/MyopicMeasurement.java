

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

import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Myopic PSF estimation as a per-plane measurement. The plane is cropped to the largest centred
 * power-of-two region, optionally apodised, and its normalised power spectrum is fitted.
 */
class MyopicMeasurement implements PlaneMeasurement {

    static final String NAME = "myopic_psf";

    static final String GML = "GML";
    static final String CONVERGED = "Converged";
    static final String EVALUATIONS = "Evaluations";

    private final MyopicEstimator estimator;
    private final ZernikeModeSet modes;
    private final Map<String, Double> initial_guess;
    private final boolean fit_resolution;
    private final OptimizerOptions options;
    private final int apodisation_border;


    MyopicMeasurement(MyopicEstimator estimator, ZernikeModeSet modes, Map<String, Double> initial_guess,
                      boolean fit_resolution, OptimizerOptions options, int apodisation_border) {
        this.estimator = estimator;
        this.modes = modes;
        this.initial_guess = initial_guess;
        this.fit_resolution = fit_resolution;
        this.options = options;
        this.apodisation_border = apodisation_border;
    }


    MyopicMeasurement(MyopicEstimator estimator, MyopicSettings settings) {
        this(estimator, settings.modes(), settings.initialGuess(), settings.fit_resolution,
                settings.optimizerOptions(), settings.apodisation_border);
    }


    public String getName() {
        return NAME;
    }


    public Map<String, Double> measure(ImageProcessor plane, PlaneMetadata metadata) {
        MyopicEstimator.GML_result result = fitPlane(plane);

        Map<String, Double> values = new LinkedHashMap<>(result.asMap());
        values.put(GML, result.final_cost);
        values.put(CONVERGED, result.converged ? 1.0 : 0.0);
        values.put(EVALUATIONS, (double) result.cost_trace.length);
        return values;
    }


    /**
     * Method to run the fit on a plane and keep the full result, cost trace included.
     *
     * @param plane Any ImageJ processor type; values are taken as floats
     * @return The fit result
     */
    MyopicEstimator.GML_result fitPlane(ImageProcessor plane) {
        double[][] image = PowerSpectrum.cropToPowerOfTwo(
                ArrayConversions.convertFloatToDouble(plane.getFloatArray()));
        if (this.apodisation_border > 0) {
            image = PowerSpectrum.apodise(image, this.apodisation_border, PowerSpectrum.DEFAULT_APODISATION_ORDER);
        }
        double[][] psd = PowerSpectrum.calculate(image, true);
        return this.estimator.fit(psd, this.modes, this.initial_guess, this.fit_resolution, this.options, null);
    }


    /** Method to return the side lengths of the region the fit works on for a plane of the given size */
    static int[] fittedSize(int width, int height) {
        return new int[] {Integer.highestOneBit(width), Integer.highestOneBit(height)};
    }
}
