

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

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerOptionsTest {

    @Test
    void defaults() {
        OptimizerOptions options = new OptimizerOptions();
        assertEquals(OptimizerOptions.Method.NELDER_MEAD, options.getMethod());
        assertEquals(20000, options.getMaxEvaluations());
        assertEquals(1e-10, options.getRelativeTolerance(), 0.0);
    }

    @Test
    void settersChain() {
        OptimizerOptions options = new OptimizerOptions()
                .setMethod(OptimizerOptions.Method.POWELL)
                .setMaxEvaluations(50)
                .setMaxIterations(20)
                .setTolerances(1e-6, 1e-12);
        assertEquals(OptimizerOptions.Method.POWELL, options.getMethod());
        assertEquals(50, options.getMaxEvaluations());
        assertEquals(20, options.getMaxIterations());
        assertEquals(1e-12, options.getAbsoluteTolerance(), 0.0);
    }

    @Test
    void invalidSettingsAreRejected() {
        OptimizerOptions options = new OptimizerOptions();
        assertThrows(NotStrictlyPositiveException.class, () -> options.setMaxEvaluations(0));
        assertThrows(NotStrictlyPositiveException.class, () -> options.setMaxIterations(-1));
        assertThrows(NumberIsTooSmallException.class, () -> options.setTolerances(1e-17, 1e-12));
        assertThrows(NotStrictlyPositiveException.class, () -> options.setTolerances(1e-6, 0.0));
        assertThrows(NotStrictlyPositiveException.class, () -> options.setSimplexStep(0.0, 1e-3));
    }

    @Test
    void simplexStepsScaleWithTheStartingPoint() {
        OptimizerOptions options = new OptimizerOptions().setSimplexStep(0.1, 1e-3);
        assertArrayEquals(new double[] {0.2, 1e-3, 0.5}, options.simplexSteps(new double[] {2.0, 1e-6, -5.0}), 1e-15);
    }
}
