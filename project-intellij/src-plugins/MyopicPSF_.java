

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
import ij.ImagePlus;
import ij.gui.NewImage;
import ij.gui.Plot;
import ij.plugin.filter.PlugInFilter;
import ij.process.ImageProcessor;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;


/**
 * An ImageJ plugin to estimate the optical transfer function and the object power-law prior of
 * the current image plane, from its power spectrum alone.
 */
public class MyopicPSF_ implements PlugInFilter {
    private ImagePlus imp;
    private MyopicSettings settings = MyopicSettings.load();

    // One cache of radial polynomials for every run in the session
    private static final ZernikePolynomials zernike = new ZernikePolynomials();

    private static MyopicEstimator.GML_result gml_result;

    private DecimalFormat four_dp = new DecimalFormat("0.0000");
    private DecimalFormat sci = new DecimalFormat("0.0000E0");


    /** Method to enable or disable the display of plots
     *
     * @param show_plots Boolean value to set plot display on or off
     */
    void setPlotting(boolean show_plots) { this.settings.show_plots = show_plots; }


    /** Method to enable or disable writing to the ImageJ log
     *
     * @param log_condition Boolean value to set logging on or off
     */
    void setLogging(boolean log_condition) { this.settings.log_results = log_condition; }


    /** Method to return the result of the last run
     *
     * @return The fit result, or null if the plugin has not completed a run
     */
    MyopicEstimator.GML_result getGMLResult() { return gml_result; }


    /**
     * This method is called when the plugin is loaded.
     *
     * @param arg If <i>defaults</i> then the estimation runs with the saved settings, otherwise the
     *            user is prompted for them.
     * @param imp Passed to the routine automatically by ImageJ.
     * @return DONE if unsuccessful; DOES_ALL if complete
     */
    public int setup(String arg, ImagePlus imp) {
        this.imp = imp;

        if (this.imp == null) {
            IJ.error("Myopic PSF", "An image is required");
            return DONE;
        }

        if ((arg == null) || !arg.equals("defaults")) {
            if (!this.settings.showDialog("Myopic PSF options", false)) {
                return DONE;
            }
            this.settings.save();
        }
        return DOES_ALL + NO_CHANGES;
    }


    /**
     * This method is called automatically by ImageJ once the <i>setup</i> method has completed.
     * The current plane is cropped to a power-of-two size, its power spectrum calculated and the
     * GML criterion minimised. The fitted parameters are written to the log; the cost of every
     * evaluation and the fitted transfer function are displayed.
     *
     * @param ip The ImageProcessor that is passed to this method automatically by ImageJ
     */
    public void run(ImageProcessor ip) {
        MyopicEstimator estimator = new MyopicEstimator(zernike);
        estimator.setLogging(this.settings.log_results);
        MyopicMeasurement measurement = new MyopicMeasurement(estimator, this.settings);

        MyopicEstimator.GML_result result;
        try {
            result = measurement.fitPlane(ip);
        }
        catch (RuntimeException e) {
            IJ.error("Myopic PSF", "The estimation failed:\n" + e.getMessage());
            return;
        }

        if (this.settings.show_plots) {
            plotCostTrace(result.cost_trace);

            int[] size = MyopicMeasurement.fittedSize(ip.getWidth(), ip.getHeight());
            double[][] otf = estimator.transferFunction(result.params, size[0], size[1]);
            ImagePlus otf_image = NewImage.createFloatImage("Fitted OTF", size[0], size[1], 1, NewImage.FILL_BLACK);
            otf_image.getProcessor().setFloatArray(ArrayConversions.convertDoubleToFloat(otf));
            otf_image.getProcessor().resetMinAndMax();
            otf_image.show();
        }

        if (this.settings.log_results) logResult(result);

        gml_result = result;
    }


    private void plotCostTrace(double[] cost_trace) {
        double[][] defined = definedCosts(cost_trace);
        if (defined[0].length == 0) {
            IJ.log("Myopic PSF: no evaluation gave a defined GML, the cost plot is not shown");
            return;
        }
        Plot plot_cost = new Plot("GML cost", "Evaluation", "GML");
        plot_cost.add("line", defined[0], defined[1]);
        plot_cost.show();
    }


    /**
     * Method to pick the evaluations of a cost trace where the criterion was defined
     *
     * @param cost_trace The cost of every evaluation, in order
     * @return The one-based evaluation numbers [0] and their costs [1]
     */
    static double[][] definedCosts(double[] cost_trace) {
        List<Double> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        for (int i=0; i<cost_trace.length; i++) {
            if (cost_trace[i] < MyopicEstimator.ILL_POSED_PENALTY) {
                x.add((double) (i + 1));
                y.add(cost_trace[i]);
            }
        }
        double[][] defined = new double[2][x.size()];
        for (int i=0; i<x.size(); i++) {
            defined[0][i] = x.get(i);
            defined[1][i] = y.get(i);
        }
        return defined;
    }


    private void logResult(MyopicEstimator.GML_result result) {
        IJ.log("Myopic PSF: " + this.imp.getTitle());
        IJ.log("Parameter, Value");
        for (Map.Entry<String, Double> entry : result.asMap().entrySet()) {
            IJ.log(entry.getKey() + ", " + this.four_dp.format(entry.getValue()));
        }
        IJ.log(MyopicMeasurement.GML + ", " + this.sci.format(result.final_cost));
        IJ.log(MyopicMeasurement.CONVERGED + ", " + result.converged);
        IJ.log(MyopicMeasurement.EVALUATIONS + ", " + result.cost_trace.length);
    }
}
