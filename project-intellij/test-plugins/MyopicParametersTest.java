

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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MyopicParametersTest {

    private static final ZernikeModeSet MODES = ZernikeModeSet.ASTIGMATISM_AND_SPHERICAL;

    @Test
    void defaults() {
        MyopicParameters params = MyopicParameters.defaults(MODES);
        assertEquals(1.0, params.getAlpha(), 0.0);
        assertEquals(2.0, params.getBeta(), 0.0);
        assertEquals(2.0, params.getResolution(), 0.0);
        assertArrayEquals(new double[] {1e-6, 1e-6, 1e-6}, params.getAmplitudes(), 0.0);
    }

    @Test
    void mergeOverridesByKey() {
        Map<String, Double> guess = new HashMap<>();
        guess.put("ALPHA", 0.5);
        guess.put("Z(2,2)", 0.1);
        guess.put("4,0", -0.2);

        MyopicParameters params = MyopicParameters.defaults(MODES).merge(guess);
        assertEquals(0.5, params.getAlpha(), 0.0);
        assertEquals(2.0, params.getBeta(), 0.0);
        assertEquals(1e-6, params.getAmplitude(new ZernikeMode(2, -2)), 0.0);
        assertEquals(0.1, params.getAmplitude(new ZernikeMode(2, 2)), 0.0);
        assertEquals(-0.2, params.getAmplitude(new ZernikeMode(4, 0)), 0.0);
    }

    @Test
    void mergeWithNothingKeepsTheParameters() {
        MyopicParameters params = MyopicParameters.defaults(MODES);
        assertSame(params, params.merge(null));
        assertSame(params, params.merge(new HashMap<String, Double>()));
    }

    @Test
    void mergeRejectsUnknownKeys() {
        Map<String, Double> guess = new HashMap<>();
        guess.put("gamma", 1.0);
        assertThrows(MathIllegalArgumentException.class, () -> MyopicParameters.defaults(MODES).merge(guess));

        Map<String, Double> other_mode = new HashMap<>();
        other_mode.put("Z(3,1)", 1.0);
        assertThrows(MathIllegalArgumentException.class, () -> MyopicParameters.defaults(MODES).merge(other_mode));
    }

    @Test
    void mergeRejectsNullValues() {
        Map<String, Double> guess = new HashMap<>();
        guess.put(MyopicParameters.BETA, null);
        assertThrows(NullArgumentException.class, () -> MyopicParameters.defaults(MODES).merge(guess));
    }

    @Test
    void flatArrayLayout() {
        MyopicParameters params = new MyopicParameters(MODES, 1.5, 2.5, 3.5, new double[] {0.1, 0.2, 0.3});
        assertArrayEquals(new double[] {1.5, 2.5, 3.5, 0.1, 0.2, 0.3}, params.toArray(true), 0.0);
        assertArrayEquals(new double[] {1.5, 2.5, 0.1, 0.2, 0.3}, params.toArray(false), 0.0);
    }

    @Test
    void fromArrayWithoutResolutionKeepsItExactly() {
        double resolution = 2.123456789;
        MyopicParameters params = new MyopicParameters(MODES, 1.0, 2.0, resolution, new double[3]);
        MyopicParameters updated = params.fromArray(new double[] {0.0, 1.0, 0.4, 0.5, 0.6}, false);
        assertEquals(resolution, updated.getResolution(), 0.0);
        assertEquals(0.0, updated.getAlpha(), 0.0);
        assertArrayEquals(new double[] {0.4, 0.5, 0.6}, updated.getAmplitudes(), 0.0);

        assertThrows(DimensionMismatchException.class, () -> params.fromArray(new double[4], true));
    }

    @Test
    void mapIsOrderedAndLabelled() {
        MyopicParameters params = new MyopicParameters(MODES, 1.0, 2.0, 3.0, new double[] {4.0, 5.0, 6.0});
        Map<String, Double> map = params.asMap();
        List<String> keys = new ArrayList<>(map.keySet());
        assertEquals(6, keys.size());
        assertEquals(MyopicParameters.ALPHA, keys.get(0));
        assertEquals(MyopicParameters.RESOLUTION, keys.get(2));
        assertEquals("Z(2,-2)", keys.get(3));
        assertEquals("Z(4,0)", keys.get(5));
        assertEquals(6.0, map.get("Z(4,0)"), 0.0);
        assertThrows(UnsupportedOperationException.class, () -> map.put("beta", 0.0));
    }

    @Test
    void pistonLeadsTheAmplitudes() {
        MyopicParameters params = new MyopicParameters(MODES, 1.0, 2.0, 3.0, new double[] {4.0, 5.0, 6.0});
        assertArrayEquals(new double[] {1.0, 4.0, 5.0, 6.0}, params.amplitudesWithPiston(), 0.0);
    }

    @Test
    void amplitudeCountMustMatchModes() {
        assertThrows(DimensionMismatchException.class, () -> new MyopicParameters(MODES, 1.0, 2.0, 3.0, new double[2]));
    }
}
