

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
import org.apache.commons.math3.exception.NotStrictlyPositiveException;

/**
 * The coordinate grids matching an nx by ny power spectrum with zero frequency at [nx/2][ny/2].
 * <br><br>
 * Two different radial coordinates are held and they must not be mixed up:
 * <ul>
 *     <li><i>rho</i> and <i>phi</i>: pupil-plane polar coordinates spanning [-1, 1] on both
 *     axes, used by the Zernike transfer function</li>
 *     <li><i>distance</i>: radial spatial frequency in cycles per pixel, built from the signed
 *     FFT sample frequencies, used by the power-law prior</li>
 * </ul>
 * A grid is built once per image size and only read afterwards.
 */
public final class FrequencyGrid {

    private final int nx;
    private final int ny;
    private final double[][] rho;
    private final double[][] phi;
    private final double[][] distance;

    private FrequencyGrid(int nx, int ny, double[][] rho, double[][] phi, double[][] distance) {
        this.nx = nx;
        this.ny = ny;
        this.rho = rho;
        this.phi = phi;
        this.distance = distance;
    }


    /**
     * Method to build the grids for a spectrum of nx by ny samples.
     *
     * @param nx Number of samples along the first array dimension (image width)
     * @param ny Number of samples along the second array dimension (image height)
     * @return The grids
     */
    static FrequencyGrid build(int nx, int ny) {
        if (nx <= 0) throw new NotStrictlyPositiveException(nx);
        if (ny <= 0) throw new NotStrictlyPositiveException(ny);

        double[] x = linspace(-1.0, 1.0, nx);
        double[] y = linspace(-1.0, 1.0, ny);
        double[] fx = centredFrequencies(nx);
        double[] fy = centredFrequencies(ny);

        double[][] rho = new double[nx][ny];
        double[][] phi = new double[nx][ny];
        double[][] distance = new double[nx][ny];

        for (int i=0; i<nx; i++) {
            for (int j=0; j<ny; j++) {
                rho[i][j] = Math.sqrt(x[i] * x[i] + y[j] * y[j]);
                phi[i][j] = Math.atan2(y[j], x[i]);
                distance[i][j] = Math.sqrt(fx[i] * fx[i] + fy[j] * fy[j]);
            }
        }
        return new FrequencyGrid(nx, ny, rho, phi, distance);
    }


    /**
     * Method to return n evenly spaced values from start to stop inclusive. A single
     * sample sits at start.
     */
    static double[] linspace(double start, double stop, int n) {
        double[] values = new double[n];
        double step = (n > 1) ? (stop - start) / (n - 1) : 0.0;
        for (int i=0; i<n; i++) {
            values[i] = start + i * step;
        }
        if (n > 1) values[n - 1] = stop;
        return values;
    }


    /**
     * Method to return the signed FFT sample frequencies (cycles per sample) of an n point
     * transform, reordered so that zero frequency is at index n/2.
     * <br><br>
     * For n = 8 this gives -0.5, -0.375, ..., 0.375.
     */
    static double[] centredFrequencies(int n) {
        double[] freq = new double[n];
        for (int i=0; i<n; i++) {
            freq[i] = (double) (i - n / 2) / n;
        }
        return freq;
    }


    /**
     * Method to check that an array has the dimensions of this grid.
     *
     * @param values The array to check, e.g. a power spectrum
     * @throws DimensionMismatchException if either dimension differs
     */
    void checkShape(double[][] values) {
        if (values.length != this.nx) {
            throw new DimensionMismatchException(values.length, this.nx);
        }
        for (double[] column : values) {
            if (column.length != this.ny) {
                throw new DimensionMismatchException(column.length, this.ny);
            }
        }
    }


    int getNx() { return this.nx; }
    int getNy() { return this.ny; }

    // The arrays are shared, not copied. Callers must not write to them.
    double[][] getRho() { return this.rho; }
    double[][] getPhi() { return this.phi; }
    double[][] getDistance() { return this.distance; }
}
