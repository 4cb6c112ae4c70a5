

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

/**
 * Power-law prior on the object power spectrum:
 * <br><br>
 * P(f) = 10<sup>&alpha;</sup>.(|f| + &epsilon;)<sup>|&beta;|</sup>
 * <br><br>
 * where f is the radial frequency and &epsilon; the machine epsilon, which keeps the prior finite
 * and non-zero at zero frequency. The absolute value of &beta; is always used, so the prior never
 * decreases with frequency whatever sign the optimiser tries.
 */
final class PowerLawPrior {

    static final double EPSILON = Math.ulp(1.0);

    private PowerLawPrior() {
    }


    /**
     * Method to evaluate the prior on a frequency grid.
     *
     * @param distance Radial frequency of every sample
     * @param alpha Base-10 logarithm of the prior scale
     * @param beta Power-law exponent; only its magnitude is used
     * @return Array with the dimensions of distance
     */
    static double[][] evaluate(double[][] distance, double alpha, double beta) {
        double scale = Math.pow(10.0, alpha);
        double exponent = Math.abs(beta);

        double[][] prior = new double[distance.length][];
        for (int i=0; i<distance.length; i++) {
            prior[i] = new double[distance[i].length];
            for (int j=0; j<distance[i].length; j++) {
                prior[i][j] = scaledValue(distance[i][j], scale, exponent);
            }
        }
        return prior;
    }


    /** Method to evaluate the prior at a single frequency */
    static double value(double distance, double alpha, double beta) {
        return scaledValue(distance, Math.pow(10.0, alpha), Math.abs(beta));
    }


    private static double scaledValue(double distance, double scale, double exponent) {
        return scale * Math.pow(Math.abs(distance) + EPSILON, exponent);
    }
}
