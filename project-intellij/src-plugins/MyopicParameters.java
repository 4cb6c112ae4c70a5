

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

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.NullArgumentException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The full parameter set of a myopic estimation: the prior parameters (alpha, beta), the
 * resolution that sets the pupil scale, and one amplitude per Zernike mode.
 * <br><br>
 * Instances are immutable. The optimiser works on the flat array from {@link #toArray(boolean)}
 * and the result is turned back into parameters with {@link #fromArray(double[], boolean)}.
 */
public final class MyopicParameters {

    static final String ALPHA = "alpha";
    static final String BETA = "beta";
    static final String RESOLUTION = "resolution";

    static final double DEFAULT_ALPHA = 1.0;
    static final double DEFAULT_BETA = 2.0;
    static final double DEFAULT_RESOLUTION = 2.0;
    static final double DEFAULT_AMPLITUDE = 1e-6;

    private final ZernikeModeSet modes;
    private final double alpha;
    private final double beta;
    private final double resolution;
    private final double[] amplitudes;

    MyopicParameters(ZernikeModeSet modes, double alpha, double beta, double resolution, double[] amplitudes) {
        if (amplitudes.length != modes.size()) {
            throw new DimensionMismatchException(amplitudes.length, modes.size());
        }
        this.modes = modes;
        this.alpha = alpha;
        this.beta = beta;
        this.resolution = resolution;
        this.amplitudes = amplitudes.clone();
    }


    /**
     * Method to create the default starting point: alpha = 1, beta = 2, resolution = 2 and a
     * small amplitude of 1e-6 for every mode.
     *
     * @param modes The modes whose amplitudes are estimated
     * @return The default parameters
     */
    static MyopicParameters defaults(ZernikeModeSet modes) {
        double[] amplitudes = new double[modes.size()];
        Arrays.fill(amplitudes, DEFAULT_AMPLITUDE);
        return new MyopicParameters(modes, DEFAULT_ALPHA, DEFAULT_BETA, DEFAULT_RESOLUTION, amplitudes);
    }


    /**
     * Method to override some of the parameters, key by key.
     *
     * @param overrides Values keyed by "alpha", "beta", "resolution" or a mode, written as its
     *                  label "Z(n,m)" or as "n,m". May be null.
     * @return New parameters; keys not present keep their current value
     * @throws MathIllegalArgumentException for a key that names no parameter of this set
     */
    MyopicParameters merge(Map<String, Double> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;

        double new_alpha = this.alpha;
        double new_beta = this.beta;
        double new_resolution = this.resolution;
        double[] new_amplitudes = this.amplitudes.clone();

        for (Map.Entry<String, Double> entry : overrides.entrySet()) {
            String key = entry.getKey().trim();
            if (entry.getValue() == null) {
                throw new NullArgumentException();
            }
            double value = entry.getValue();

            if (key.equalsIgnoreCase(ALPHA)) {
                new_alpha = value;
            }
            else if (key.equalsIgnoreCase(BETA)) {
                new_beta = value;
            }
            else if (key.equalsIgnoreCase(RESOLUTION)) {
                new_resolution = value;
            }
            else {
                new_amplitudes[modeIndex(key)] = value;
            }
        }
        return new MyopicParameters(this.modes, new_alpha, new_beta, new_resolution, new_amplitudes);
    }


    /**
     * Method to flatten the parameters for the optimiser: alpha, beta, [resolution,] amplitudes.
     *
     * @param include_resolution Whether the resolution is part of the optimised vector
     * @return A new array
     */
    double[] toArray(boolean include_resolution) {
        int offset = include_resolution ? 3 : 2;
        double[] values = new double[offset + this.amplitudes.length];
        values[0] = this.alpha;
        values[1] = this.beta;
        if (include_resolution) values[2] = this.resolution;
        System.arraycopy(this.amplitudes, 0, values, offset, this.amplitudes.length);
        return values;
    }


    /**
     * Method to read parameters back from a flat array laid out as by {@link #toArray(boolean)}.
     * When the resolution is not included, the resolution of this instance is kept unchanged.
     *
     * @param values The flat parameter values
     * @param include_resolution Whether values holds a resolution entry
     * @return New parameters on the same modes
     */
    MyopicParameters fromArray(double[] values, boolean include_resolution) {
        int offset = include_resolution ? 3 : 2;
        if (values.length != offset + this.modes.size()) {
            throw new DimensionMismatchException(values.length, offset + this.modes.size());
        }
        double new_resolution = include_resolution ? values[2] : this.resolution;
        double[] new_amplitudes = Arrays.copyOfRange(values, offset, values.length);
        return new MyopicParameters(this.modes, values[0], values[1], new_resolution, new_amplitudes);
    }


    /**
     * Method to return the parameters as a labelled map, in the order alpha, beta, resolution,
     * then one entry per mode labelled Z(n,m) in the order of the mode set.
     *
     * @return Unmodifiable map
     */
    Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(ALPHA, this.alpha);
        map.put(BETA, this.beta);
        map.put(RESOLUTION, this.resolution);
        for (int k=0; k<this.amplitudes.length; k++) {
            map.put(this.modes.get(k).label(), this.amplitudes[k]);
        }
        return Collections.unmodifiableMap(map);
    }


    /** Method to return the amplitudes preceded by the unit piston amplitude, matching {@link ZernikeModeSet#withPiston()} */
    double[] amplitudesWithPiston() {
        double[] result = new double[this.amplitudes.length + 1];
        result[0] = 1.0;
        System.arraycopy(this.amplitudes, 0, result, 1, this.amplitudes.length);
        return result;
    }


    double getAlpha() { return this.alpha; }
    double getBeta() { return this.beta; }
    double getResolution() { return this.resolution; }
    double getAmplitude(ZernikeMode mode) { return this.amplitudes[modeIndex(mode.label())]; }
    double[] getAmplitudes() { return this.amplitudes.clone(); }
    ZernikeModeSet getModes() { return this.modes; }


    private int modeIndex(String key) {
        ZernikeMode mode;
        try {
            mode = ZernikeMode.parse(key);
        }
        catch (MathIllegalArgumentException e) {
            throw new MathIllegalArgumentException(MyopicFormats.UNKNOWN_PARAMETER, key, this.modes.format());
        }
        int index = this.modes.indexOf(mode);
        if (index < 0) {
            throw new MathIllegalArgumentException(MyopicFormats.UNKNOWN_PARAMETER, key, this.modes.format());
        }
        return index;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
