

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

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Power spectral density of an image, and the preparation steps applied to an image plane
 * before its spectrum is taken.
 * <br><br>
 * The PSD is |FFT(image)|<sup>2</sup> with the quadrants swapped so that zero frequency is at
 * [nx/2][ny/2], optionally divided by its maximum.
 */
final class PowerSpectrum {

    static final int DEFAULT_APODISATION_ORDER = 8;

    private PowerSpectrum() {
    }


    /**
     * Method to calculate the centred power spectral density of an image.
     *
     * @param image Image values indexed [x][y]; both dimensions must be powers of two
     * @param normalise Whether to divide the result by its maximum
     * @return The PSD, same dimensions as the image
     * @throws MathIllegalArgumentException if a dimension is not a power of two
     */
    static double[][] calculate(double[][] image, boolean normalise) {
        if (image.length == 0 || image[0].length == 0) {
            throw new MathIllegalArgumentException(MyopicFormats.EMPTY_IMAGE);
        }
        checkPowerOfTwo(image.length);
        checkPowerOfTwo(image[0].length);

        TwoDFFT twod_transformer = new TwoDFFT();
        double[][] psd = twod_transformer.absSquared(twod_transformer.transform(image, DftNormalization.STANDARD));
        psd = twod_transformer.swapQuadrants(psd);

        if (normalise) {
            double max = ArrayConversions.max(psd);
            // A blank image has an all-zero spectrum, which is left as it is
            if (max > 0.0) psd = ArrayConversions.multiply(psd, 1.0 / max);
        }
        return psd;
    }


    /**
     * Method to taper the borders of an image towards zero so that the image edges do not
     * show up as a cross in its spectrum.
     * <br><br>
     * The image is multiplied by the outer product of two generalised Gaussian windows,
     * one per axis:
     * <br><br>
     * w(n) = exp(-0.5 |(n - (M-1)/2) / &sigma;|<sup>2p</sup>), &sigma; = M/2 - border
     *
     * @param image Image values indexed [x][y]
     * @param border Width of the tapered border in pixels
     * @param order The order p of the generalised Gaussian; higher orders give a flatter centre
     * @return The apodised image
     */
    static double[][] apodise(double[][] image, int border, int order) {
        int nx = image.length;
        int ny = image[0].length;
        double[] window_x = generalGaussian(nx, order, nx / 2 - border);
        double[] window_y = generalGaussian(ny, order, ny / 2 - border);

        double[][] result = new double[nx][ny];
        for (int i=0; i<nx; i++) {
            for (int j=0; j<ny; j++) {
                result[i][j] = image[i][j] * window_x[i] * window_y[j];
            }
        }
        return result;
    }


    /**
     * Method to calculate a generalised Gaussian window of M samples.
     *
     * @param num_samples Number of samples M
     * @param p Shape parameter; 1 gives a Gaussian
     * @param sigma Width parameter in samples
     * @return The window values
     */
    static double[] generalGaussian(int num_samples, double p, double sigma) {
        if (sigma <= 0) {
            throw new NotStrictlyPositiveException(LocalizedFormats.STANDARD_DEVIATION, sigma);
        }
        double[] window = new double[num_samples];
        double centre = (num_samples - 1) / 2.0;
        for (int n=0; n<num_samples; n++) {
            window[n] = Math.exp(-0.5 * Math.pow(Math.abs((n - centre) / sigma), 2.0 * p));
        }
        return window;
    }


    /**
     * Method to crop an image to the largest power-of-two size on each axis, keeping the centre.
     *
     * @param image Image values indexed [x][y]
     * @return The cropped image, or the input itself if it already has power-of-two dimensions
     */
    static double[][] cropToPowerOfTwo(double[][] image) {
        int nx = image.length;
        int ny = image[0].length;
        int crop_x = Integer.highestOneBit(nx);
        int crop_y = Integer.highestOneBit(ny);
        if (crop_x == nx && crop_y == ny) return image;

        return ArrayConversions.crop(image, (nx - crop_x) / 2, (ny - crop_y) / 2, crop_x, crop_y);
    }


    private static void checkPowerOfTwo(int n) {
        if (!ArithmeticUtils.isPowerOfTwo(n)) {
            throw new MathIllegalArgumentException(LocalizedFormats.NOT_POWER_OF_TWO_CONSIDER_PADDING, n);
        }
    }
}
