

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
 * Thrown when a Zernike index pair (n, m) breaks n &ge; 0, |m| &le; n or, where a
 * radial polynomial is requested, the even parity of n - m.
 */
public class InvalidZernikeModeException extends MathIllegalArgumentException {

    private static final long serialVersionUID = 4417863052139186211L;

    private final int n;
    private final int m;

    /**
     * @param n The radial degree that was requested
     * @param m The azimuthal frequency that was requested
     * @param reason Short description of the broken rule
     */
    public InvalidZernikeModeException(int n, int m, String reason) {
        super(MyopicFormats.INVALID_ZERNIKE_MODE, n, m, reason);
        this.n = n;
        this.m = m;
    }

    public int getN() { return this.n; }
    public int getM() { return this.m; }
}
