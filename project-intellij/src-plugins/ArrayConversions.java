

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

/**
 * Conversions and element-wise helpers for the two-dimensional arrays passed between
 * ImageJ processors and the spectral estimation code. Arrays are indexed [x][y], the
 * layout returned by {@link ij.process.ImageProcessor#getFloatArray()}.
 */
public class ArrayConversions {

    /**
     *
     * @param values Two-dimensional array of float values
     * @return Two-dimensional array of double values
     */
    public static double[][] convertFloatToDouble(final float[][] values) {
        checkNotEmpty(values.length);
        int width = values.length;
        int height = values[0].length;

        final double[][] result = new double[width][height];

        for (int i=0; i<width; i++) {
            for (int j=0; j<height; j++) {
                result[i][j] = values[i][j];
            }
        }
        return result;
    }


    /**
     *
     * @param values Two-dimensional array of Double values
     * @return Two-dimensional array of Float values
     */
    public static float[][] convertDoubleToFloat(final double[][] values) {
        checkNotEmpty(values.length);
        int width = values.length;
        int height = values[0].length;

        final float[][] result = new float[width][height];

        for (int i=0; i<width; i++) {
            for (int j=0; j<height; j++) {
                result[i][j] = (float) values[i][j];
            }
        }
        return result;
    }


    /**
     * Method to multiply every element in a 2D double array by a value.
     *
     * @param values Two-dimensional array whose elements are to be scaled
     * @param mult_val The factor to scale the array values by
     * @return New array of the same dimensions as the input
     */
    static double[][] multiply(final double[][] values, final double mult_val) {
        final double[][] result = new double[values.length][];

        for (int i=0; i<values.length; i++) {
            result[i] = new double[values[i].length];
            for (int j=0; j<values[i].length; j++) {
                result[i][j] = values[i][j] * mult_val;
            }
        }
        return result;
    }


    /** Method to return the largest element of a 2D array */
    static double max(final double[][] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double[] column : values) {
            for (double value : column) {
                if (value > max) max = value;
            }
        }
        return max;
    }


    /** Method to return the sum of all elements of a 2D array */
    static double sum(final double[][] values) {
        double sum = 0.0;
        for (double[] column : values) {
            for (double value : column) {
                sum += value;
            }
        }
        return sum;
    }


    /**
     * Method to copy the rectangle [x0, x0 + width) x [y0, y0 + height) out of a 2D array.
     */
    static double[][] crop(final double[][] values, int x0, int y0, int width, int height) {
        final double[][] result = new double[width][height];
        for (int i=0; i<width; i++) {
            System.arraycopy(values[x0 + i], y0, result[i], 0, height);
        }
        return result;
    }


    private static void checkNotEmpty(int length) {
        if (length == 0) {
            throw new MathIllegalArgumentException(MyopicFormats.EMPTY_IMAGE);
        }
    }
}
