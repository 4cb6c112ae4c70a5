

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
import ij.Prefs;
import ij.gui.GenericDialog;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings shared by the myopic PSF plugins. They are kept between sessions in the ImageJ
 * preferences (keys starting with "myopic.") and edited with a dialog, which also makes them
 * recordable in macros.
 */
class MyopicSettings {

    private static final String PREFS_PREFIX = "myopic.";

    static final String[] METHOD_NAMES = {"Nelder-Mead", "Multi-directional", "Powell"};

    String modes_text = ZernikeModeSet.ASTIGMATISM_AND_SPHERICAL.format();
    double alpha = MyopicParameters.DEFAULT_ALPHA;
    double beta = MyopicParameters.DEFAULT_BETA;
    double resolution = MyopicParameters.DEFAULT_RESOLUTION;
    boolean fit_resolution = true;

    String method = METHOD_NAMES[0];
    int max_evaluations = OptimizerOptions.DEFAULT_MAX_EVALUATIONS;
    int max_iterations = OptimizerOptions.DEFAULT_MAX_ITERATIONS;
    double relative_tolerance = OptimizerOptions.DEFAULT_RELATIVE_TOLERANCE;
    double simplex_step = OptimizerOptions.DEFAULT_SIMPLEX_STEP;

    int apodisation_border = 0; // pixels, 0 to switch apodisation off
    int num_threads = 1;

    boolean show_plots = true;
    boolean log_results = true;


    /** Method to read the settings saved by a previous session, falling back to the defaults */
    static MyopicSettings load() {
        MyopicSettings settings = new MyopicSettings();
        settings.modes_text = Prefs.get(PREFS_PREFIX + "modes", settings.modes_text);
        settings.alpha = Prefs.get(PREFS_PREFIX + "alpha", settings.alpha);
        settings.beta = Prefs.get(PREFS_PREFIX + "beta", settings.beta);
        settings.resolution = Prefs.get(PREFS_PREFIX + "resolution", settings.resolution);
        settings.fit_resolution = Prefs.get(PREFS_PREFIX + "fit_resolution", settings.fit_resolution);
        settings.method = Prefs.get(PREFS_PREFIX + "method", settings.method);
        settings.max_evaluations = (int) Prefs.get(PREFS_PREFIX + "max_evaluations", settings.max_evaluations);
        settings.max_iterations = (int) Prefs.get(PREFS_PREFIX + "max_iterations", settings.max_iterations);
        settings.relative_tolerance = Prefs.get(PREFS_PREFIX + "relative_tolerance", settings.relative_tolerance);
        settings.simplex_step = Prefs.get(PREFS_PREFIX + "simplex_step", settings.simplex_step);
        settings.apodisation_border = (int) Prefs.get(PREFS_PREFIX + "apodisation_border", settings.apodisation_border);
        settings.num_threads = (int) Prefs.get(PREFS_PREFIX + "threads", settings.num_threads);
        settings.show_plots = Prefs.get(PREFS_PREFIX + "show_plots", settings.show_plots);
        settings.log_results = Prefs.get(PREFS_PREFIX + "log_results", settings.log_results);
        return settings;
    }


    /** Method to store the settings in the ImageJ preferences */
    void save() {
        Prefs.set(PREFS_PREFIX + "modes", this.modes_text);
        Prefs.set(PREFS_PREFIX + "alpha", this.alpha);
        Prefs.set(PREFS_PREFIX + "beta", this.beta);
        Prefs.set(PREFS_PREFIX + "resolution", this.resolution);
        Prefs.set(PREFS_PREFIX + "fit_resolution", this.fit_resolution);
        Prefs.set(PREFS_PREFIX + "method", this.method);
        Prefs.set(PREFS_PREFIX + "max_evaluations", this.max_evaluations);
        Prefs.set(PREFS_PREFIX + "max_iterations", this.max_iterations);
        Prefs.set(PREFS_PREFIX + "relative_tolerance", this.relative_tolerance);
        Prefs.set(PREFS_PREFIX + "simplex_step", this.simplex_step);
        Prefs.set(PREFS_PREFIX + "apodisation_border", this.apodisation_border);
        Prefs.set(PREFS_PREFIX + "threads", this.num_threads);
        Prefs.set(PREFS_PREFIX + "show_plots", this.show_plots);
        Prefs.set(PREFS_PREFIX + "log_results", this.log_results);
    }


    /**
     * Method to let the user edit the settings.
     *
     * @param title Dialog title
     * @param batch Whether to offer the batch-only fields (thread count)
     * @return false if the dialog was cancelled or a value could not be used
     */
    boolean showDialog(String title, boolean batch) {
        GenericDialog gd = new GenericDialog(title);
        gd.addStringField("Zernike modes (n,m; n,m; ...)", this.modes_text, 25);
        gd.addNumericField("Initial alpha (log10 prior scale)", this.alpha, 3);
        gd.addNumericField("Initial beta (prior exponent)", this.beta, 3);
        gd.addNumericField("Initial resolution", this.resolution, 3);
        gd.addCheckbox("Fit resolution", this.fit_resolution);
        gd.addChoice("Minimiser", METHOD_NAMES, this.method);
        gd.addNumericField("Maximum evaluations", this.max_evaluations, 0);
        gd.addNumericField("Maximum iterations", this.max_iterations, 0);
        gd.addStringField("Relative tolerance", String.valueOf(this.relative_tolerance), 10);
        gd.addNumericField("Initial simplex step (fraction)", this.simplex_step, 3);
        gd.addNumericField("Apodisation border (pixels, 0 for none)", this.apodisation_border, 0);
        if (batch) gd.addNumericField("Threads", this.num_threads, 0);
        gd.addCheckbox("Show plots", this.show_plots);
        gd.addCheckbox("Write results to the log", this.log_results);
        gd.showDialog();
        if (gd.wasCanceled()) {
            return false;
        }

        this.modes_text = gd.getNextString();
        this.alpha = gd.getNextNumber();
        this.beta = gd.getNextNumber();
        this.resolution = gd.getNextNumber();
        this.fit_resolution = gd.getNextBoolean();
        this.method = gd.getNextChoice();
        this.max_evaluations = (int) gd.getNextNumber();
        this.max_iterations = (int) gd.getNextNumber();
        String tolerance_text = gd.getNextString();
        this.simplex_step = gd.getNextNumber();
        this.apodisation_border = (int) gd.getNextNumber();
        if (batch) this.num_threads = Math.max(1, (int) gd.getNextNumber());
        this.show_plots = gd.getNextBoolean();
        this.log_results = gd.getNextBoolean();

        try {
            this.relative_tolerance = Double.parseDouble(tolerance_text.trim());
            modes();
            optimizerOptions();
        }
        catch (NumberFormatException e) {
            IJ.error("Myopic PSF", "The relative tolerance is not a number: " + tolerance_text);
            return false;
        }
        catch (MathIllegalArgumentException e) {
            IJ.error("Myopic PSF", "Invalid setting:\n" + e.getMessage());
            return false;
        }
        return true;
    }


    /** Method to return the mode set described by the modes text */
    ZernikeModeSet modes() {
        return ZernikeModeSet.parse(this.modes_text);
    }


    /** Method to return the starting values of alpha, beta and resolution, keyed for {@link MyopicParameters#merge(Map)} */
    Map<String, Double> initialGuess() {
        Map<String, Double> guess = new LinkedHashMap<>();
        guess.put(MyopicParameters.ALPHA, this.alpha);
        guess.put(MyopicParameters.BETA, this.beta);
        guess.put(MyopicParameters.RESOLUTION, this.resolution);
        return guess;
    }


    OptimizerOptions optimizerOptions() {
        OptimizerOptions options = new OptimizerOptions()
                .setMaxEvaluations(this.max_evaluations)
                .setMaxIterations(this.max_iterations)
                .setTolerances(this.relative_tolerance, OptimizerOptions.DEFAULT_ABSOLUTE_TOLERANCE)
                .setSimplexStep(this.simplex_step, OptimizerOptions.DEFAULT_MIN_SIMPLEX_STEP);

        if (this.method.equals(METHOD_NAMES[1])) {
            options.setMethod(OptimizerOptions.Method.MULTI_DIRECTIONAL);
        }
        else if (this.method.equals(METHOD_NAMES[2])) {
            options.setMethod(OptimizerOptions.Method.POWELL);
        }
        else {
            options.setMethod(OptimizerOptions.Method.NELDER_MEAD);
        }
        return options;
    }
}
