

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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

class TwoDFFT {

    /** A method to carry out a two-dimensional forward Fourier transform.
     *  <br><br>
     *  The transform is separable: every column of the input is transformed, then every row
     *  of that result.
     *
     * @param input_array A two-dimensional array of double-precision values, indexed [x][y].
     *                    The length of each array dimension must be a power of two
     * @param norm_type The type of normalisation to carry out. Can be DftNormalization.STANDARD
     *                  or DftNormalization.UNITARY.
     * @return A two-dimensional array of complex numbers containing the result of the forward
     *         Fourier transform, zero frequency at [0][0]. The return array has the same
     *         dimensions as the input array.
     */
    Complex[][] transform(double[][] input_array, DftNormalization norm_type) {
        FastFourierTransformer fourier_transformer = new FastFourierTransformer(norm_type);

        Complex[][] two_d_fft = new Complex[input_array.length][];
        for (int col=0; col<input_array.length; col++) {
            two_d_fft[col] = fourier_transformer.transform(input_array[col], TransformType.FORWARD);
        }

        // Rows become columns, so the second pass is again one transform per column
        two_d_fft = transpose(two_d_fft);
        for (int col=0; col<two_d_fft.length; col++) {
            two_d_fft[col] = fourier_transformer.transform(two_d_fft[col], TransformType.FORWARD);
        }

        return transpose(two_d_fft);
    }


    /** Method to calculate the squared magnitude of every element of a 2D complex array
     *
     * @param values Two-dimensional Complex array
     * @return Two-dimensional double array of |value|<sup>2</sup>, same dimensions as the input
     */
    double[][] absSquared(Complex[][] values) {
        double[][] result = new double[values.length][];
        for (int i=0; i<values.length; i++) {
            result[i] = new double[values[i].length];
            for (int j=0; j<values[i].length; j++) {
                double re = values[i][j].getReal();
                double im = values[i][j].getImaginary();
                result[i][j] = re * re + im * im;
            }
        }
        return result;
    }


    /** Method to swap the quadrants of a two dimensional frequency domain array that is the result
     * of a 2d Fourier transform of an image.
     * <br><br>
     * Element [i][j] moves to [(i + nx/2) % nx][(j + ny/2) % ny], so zero frequency ends up at
     * [nx/2][ny/2]. This matches the usual fftshift for odd sizes as well as even ones.
     *
     * @param input_array Array of frequency data with zero frequency at 0,0
     * @return Array of frequency data with zero frequency at the centre
     */
    double[][] swapQuadrants(double[][] input_array) {
        int nx = input_array.length;
        int ny = input_array[0].length;
        double[][] shifted = new double[nx][ny];

        for (int i=0; i<nx; i++) {
            int shifted_i = (i + nx / 2) % nx;
            for (int j=0; j<ny; j++) {
                shifted[shifted_i][(j + ny / 2) % ny] = input_array[i][j];
            }
        }
        return shifted;
    }


    /** Method to transpose a 2d array of complex numbers: the row and column indices are swapped.
     *   <pre>
     *    1   2   3   4    Transpose       1   5   9  13
     *    5   6   7   8    moves between   2   6  10  14
     *    9  10  11  12    these two       3   7  11  15
     *   13  14  15  16    arrays          4   8  12  16
     *  </pre>
     *
     * @param input A two-dimensional array of complex numbers
     * @return The transpose of the input, also a two-dimensional array of complex numbers
     */
    private Complex[][] transpose(Complex[][] input) {
        Complex[][] output = new Complex[input[0].length][input.length];

        for (int i=0; i<input.length; i++) {
            for (int j=0; j<input[0].length; j++) {
                output[j][i] = input[i][j];
            }
        }

        return output;
    }
}
