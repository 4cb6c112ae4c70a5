

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

import java.util.List;

/**
 * Parametric optical transfer function built from a weighted sum of Zernike polynomials.
 * <br><br>
 * OTF(&rho;, &phi;) = &Sigma;<sub>k</sub> a<sub>k</sub>.Z<sub>k</sub>(&rho;.p, &phi;), set to zero where &rho;.p &ge; 1,
 * and divided by its own sum.
 * <br><br>
 * p is the pupil scale. The energy normalisation makes every trial OTF carry the same total energy,
 * otherwise the OTF amplitude and the prior scale could trade against each other freely.
 */
class ZernikeTransferFunction {

    private final ZernikePolynomials zernike;

    ZernikeTransferFunction(ZernikePolynomials zernike) {
        this.zernike = zernike;
    }


    /** Method to convert the fitted resolution parameter to the pupil scale p
     *
     * @param resolution The resolution parameter
     * @return resolution / &pi;
     */
    static double pupilFromResolution(double resolution) {
        return resolution / Math.PI;
    }


    /**
     * Method to evaluate the energy-normalised transfer function.
     *
     * @param rho Pupil-plane radial coordinate of every sample
     * @param phi Pupil-plane angular coordinate of every sample
     * @param pupil Pupil scale p applied to rho
     * @param amplitudes Amplitude of each mode, in the order of modes
     * @param modes The Zernike modes of the expansion
     * @return The transfer function, summing to one
     * @throws DimensionMismatchException if amplitudes and modes differ in length
     * @throws IllPosedObjectiveException if the masked expansion sums to zero or to a non-finite value
     */
    double[][] evaluate(double[][] rho, double[][] phi, double pupil, double[] amplitudes, List<ZernikeMode> modes) {
        if (amplitudes.length != modes.size()) {
            throw new DimensionMismatchException(amplitudes.length, modes.size());
        }

        int width = rho.length;
        double[][] scaled_rho = new double[width][];
        for (int i=0; i<width; i++) {
            scaled_rho[i] = new double[rho[i].length];
            for (int j=0; j<rho[i].length; j++) {
                scaled_rho[i][j] = rho[i][j] * pupil;
            }
        }

        double[][] otf = new double[width][];
        for (int i=0; i<width; i++) {
            otf[i] = new double[rho[i].length];
        }

        for (int k=0; k<modes.size(); k++) {
            ZernikeMode mode = modes.get(k);
            double[][] z_nm = this.zernike.evaluate(mode.getN(), mode.getM(), scaled_rho, phi);
            for (int i=0; i<width; i++) {
                for (int j=0; j<z_nm[i].length; j++) {
                    otf[i][j] += amplitudes[k] * z_nm[i][j];
                }
            }
        }

        // Pupil support
        double sum = 0.0;
        for (int i=0; i<width; i++) {
            for (int j=0; j<otf[i].length; j++) {
                if (scaled_rho[i][j] >= 1.0) otf[i][j] = 0.0;
                sum += otf[i][j];
            }
        }

        if (sum == 0.0 || Double.isNaN(sum) || Double.isInfinite(sum)) {
            throw new IllPosedObjectiveException(MyopicFormats.ZERO_ENERGY_TRANSFER_FUNCTION, sum);
        }
        return ArrayConversions.multiply(otf, 1.0 / sum);
    }
}
