

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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyGridTest {

    @Test
    void gridsHaveImageDimensions() {
        FrequencyGrid grid = FrequencyGrid.build(4, 8);
        assertEquals(4, grid.getNx());
        assertEquals(8, grid.getNy());
        assertEquals(4, grid.getRho().length);
        assertEquals(8, grid.getRho()[0].length);
        assertEquals(8, grid.getPhi()[3].length);
        assertEquals(8, grid.getDistance()[3].length);
    }

    @Test
    void pupilCoordinatesSpanMinusOneToOne() {
        FrequencyGrid grid = FrequencyGrid.build(5, 5);
        assertEquals(Math.sqrt(2.0), grid.getRho()[0][0], 1e-12);
        assertEquals(0.0, grid.getRho()[2][2], 1e-12);
        assertEquals(Math.PI / 2, grid.getPhi()[2][4], 1e-12);
        assertEquals(Math.PI, grid.getPhi()[0][2], 1e-12);
    }

    @Test
    void distanceIsZeroAtTheCentredOrigin() {
        FrequencyGrid grid = FrequencyGrid.build(8, 16);
        assertEquals(0.0, grid.getDistance()[4][8], 0.0);
        assertEquals(Math.sqrt(0.5 * 0.5 + 0.5 * 0.5), grid.getDistance()[0][0], 1e-12);
        assertEquals(0.125, grid.getDistance()[5][8], 1e-12);
    }

    @Test
    void centredFrequencies() {
        assertArrayEquals(new double[] {-0.5, -0.375, -0.25, -0.125, 0.0, 0.125, 0.25, 0.375},
                FrequencyGrid.centredFrequencies(8), 1e-12);
    }

    @Test
    void linspaceIncludesBothEnds() {
        assertArrayEquals(new double[] {-1.0, -0.5, 0.0, 0.5, 1.0}, FrequencyGrid.linspace(-1.0, 1.0, 5), 1e-12);
        assertArrayEquals(new double[] {-1.0}, FrequencyGrid.linspace(-1.0, 1.0, 1), 0.0);
    }

    @Test
    void invalidSizesAreRejected() {
        assertThrows(NotStrictlyPositiveException.class, () -> FrequencyGrid.build(0, 4));
        assertThrows(NotStrictlyPositiveException.class, () -> FrequencyGrid.build(4, -1));
    }

    @Test
    void checkShapeRejectsOtherDimensions() {
        FrequencyGrid grid = FrequencyGrid.build(4, 4);
        grid.checkShape(new double[4][4]);
        assertThrows(DimensionMismatchException.class, () -> grid.checkShape(new double[4][5]));
        assertThrows(DimensionMismatchException.class, () -> grid.checkShape(new double[2][4]));
    }
}
