

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

import java.util.List;

/**
 * Generalised maximum likelihood (GML) criterion for myopic estimation of the transfer function,
 * after equation 27 of Thibon, Soulez and Thi&eacute;baut, <i>Fast automatic myopic deconvolution of
 * angiogram sequence</i>, ISBI 2014,
 * <a href="https://hal.archives-ouvertes.fr/hal-00914846">https://hal.archives-ouvertes.fr/hal-00914846</a>.
 * <br><br>
 * For a prior P and an energy-normalised transfer function H, the spectral weights are
 * <br><br>
 * W = P / (|H|<sup>2</sup> + P)
 * <br><br>
 * and the criterion is
 * <br><br>
 * GML = &Sigma; W.PSD / exp(mean(log W))
 * <br><br>
 * where the mean in the denominator runs over the strictly positive weights only.
 * The transfer function always includes the piston mode (0, 0) with unit amplitude in front of
 * the estimated modes.
 */
class GeneralisedLikelihood {

    private final double[][] psd;
    private final FrequencyGrid grid;
    private final ZernikeModeSet modes;
    private final List<ZernikeMode> modes_with_piston;
    private final ZernikeTransferFunction transfer_function;

    /**
     * @param psd The power spectral density of the observed image, zero frequency at the centre
     * @param grid Coordinate grids with the dimensions of the PSD
     * @param modes The estimated Zernike modes
     * @param zernike Polynomial engine shared by all evaluations
     * @throws DimensionMismatchException if the PSD and grid dimensions differ
     */
    GeneralisedLikelihood(double[][] psd, FrequencyGrid grid, ZernikeModeSet modes, ZernikePolynomials zernike) {
        grid.checkShape(psd);
        this.psd = psd;
        this.grid = grid;
        this.modes = modes;
        this.modes_with_piston = modes.withPiston();
        this.transfer_function = new ZernikeTransferFunction(zernike);
    }


    /**
     * Method to evaluate the criterion.
     *
     * @param params Trial parameters; their mode set must be the one this criterion was built with
     * @return The GML value, finite and non-negative
     * @throws IllPosedObjectiveException if no weight is strictly positive or the value is not finite
     */
    double cost(MyopicParameters params) {
        double[][] weights = weights(params);

        double numerator = 0.0;
        double log_sum = 0.0;
        int num_positive = 0;
        int num_weights = 0;
        for (int i=0; i<weights.length; i++) {
            for (int j=0; j<weights[i].length; j++) {
                double w = weights[i][j];
                numerator += w * this.psd[i][j];
                if (w > 0.0) {
                    log_sum += Math.log(w);
                    num_positive++;
                }
                num_weights++;
            }
        }

        if (num_positive == 0) {
            throw new IllPosedObjectiveException(MyopicFormats.NO_POSITIVE_WEIGHT, num_weights);
        }

        double denominator = Math.exp(log_sum / num_positive);
        double gml = numerator / denominator;
        if (Double.isNaN(gml) || Double.isInfinite(gml)) {
            throw new IllPosedObjectiveException(MyopicFormats.NON_FINITE_COST, gml);
        }
        return gml;
    }


    /**
     * Method to calculate the spectral weights W = P / (|H|<sup>2</sup> + P).
     * Where both terms are zero the weight is zero; where the prior overflowed it is one.
     *
     * @param params Trial parameters
     * @return The weights, dimensions of the PSD
     */
    double[][] weights(MyopicParameters params) {
        checkModes(params);
        double[][] prior = PowerLawPrior.evaluate(this.grid.getDistance(), params.getAlpha(), params.getBeta());
        double[][] otf = transferFunction(params);

        double[][] weights = new double[prior.length][];
        for (int i=0; i<prior.length; i++) {
            weights[i] = new double[prior[i].length];
            for (int j=0; j<prior[i].length; j++) {
                double p = prior[i][j];
                double mtf2 = otf[i][j] * otf[i][j];
                if (Double.isInfinite(p)) {
                    weights[i][j] = 1.0;
                }
                else if (mtf2 + p > 0.0) {
                    weights[i][j] = p / (mtf2 + p);
                }
                else {
                    weights[i][j] = 0.0;
                }
            }
        }
        return weights;
    }


    /**
     * Method to evaluate the energy-normalised transfer function for a set of parameters,
     * piston included.
     *
     * @param params Trial parameters
     * @return The transfer function on the pupil grid
     */
    double[][] transferFunction(MyopicParameters params) {
        checkModes(params);
        double pupil = ZernikeTransferFunction.pupilFromResolution(params.getResolution());
        return this.transfer_function.evaluate(this.grid.getRho(), this.grid.getPhi(), pupil,
                params.amplitudesWithPiston(), this.modes_with_piston);
    }


    /**
     * Method to calculate the spectrum for which the given parameters minimise the criterion:
     * 1 / W = 1 + |H|<sup>2</sup> / P. The criterion is invariant to a scaling of the PSD, so this
     * is defined up to a constant factor. Frequencies with a zero weight are set to zero.
     *
     * @param params The parameters to model
     * @return The expected spectrum, dimensions of the PSD
     */
    double[][] expectedSpectrum(MyopicParameters params) {
        double[][] weights = weights(params);
        double[][] spectrum = new double[weights.length][];
        for (int i=0; i<weights.length; i++) {
            spectrum[i] = new double[weights[i].length];
            for (int j=0; j<weights[i].length; j++) {
                spectrum[i][j] = (weights[i][j] > 0.0) ? 1.0 / weights[i][j] : 0.0;
            }
        }
        return spectrum;
    }


    FrequencyGrid getGrid() { return this.grid; }
    ZernikeModeSet getModes() { return this.modes; }


    private void checkModes(MyopicParameters params) {
        if (!this.modes.equals(params.getModes())) {
            throw new MathIllegalArgumentException(MyopicFormats.MODE_SET_MISMATCH, params.getModes(), this.modes);
        }
    }
}
