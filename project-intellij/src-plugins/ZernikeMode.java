

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
 * A single Zernike mode, indexed by its radial degree n and azimuthal frequency m.
 * <br><br>
 * A valid mode has n &ge; 0, |m| &le; n and n - m even. Modes with m &lt; 0 use the
 * sine angular term, modes with m &ge; 0 the cosine term.
 */
public final class ZernikeMode {

    static final ZernikeMode PISTON = new ZernikeMode(0, 0);

    private final int n;
    private final int m;

    /**
     * @param n Radial degree
     * @param m Azimuthal frequency
     * @throws InvalidZernikeModeException if the pair is not a valid Zernike mode
     */
    public ZernikeMode(int n, int m) {
        ZernikePolynomials.checkIndices(n, m);
        if ((n - m) % 2 != 0) {
            throw new InvalidZernikeModeException(n, m, "n - m must be even");
        }
        this.n = n;
        this.m = m;
    }

    public int getN() { return this.n; }
    public int getM() { return this.m; }


    /** Method to return the OSA/ANSI single index of this mode.
     *
     * @return (n(n+2)+m)/2
     */
    int standardIndex() {
        return ZernikePolynomials.standardIndex(this.n, this.m);
    }


    /** Method to return the label used for this mode in parameter maps and result tables.
     *
     * @return The label, e.g. Z(2,-2)
     */
    String label() {
        return "Z(" + this.n + "," + this.m + ")";
    }


    /**
     * Method to read a mode from text. Accepts "n,m", "(n,m)" and the label form "Z(n,m)".
     *
     * @param text The text to parse
     * @return The mode
     * @throws MathIllegalArgumentException if the text does not contain two integers
     * @throws InvalidZernikeModeException if the integers do not form a valid mode
     */
    static ZernikeMode parse(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("Z") || trimmed.startsWith("z")) trimmed = trimmed.substring(1);
        trimmed = trimmed.replace("(", "").replace(")", "").trim();

        String[] parts = trimmed.split(",");
        if (parts.length != 2) {
            throw new MathIllegalArgumentException(MyopicFormats.UNPARSABLE_ZERNIKE_MODE, text);
        }
        try {
            return new ZernikeMode(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        }
        catch (NumberFormatException e) {
            throw new MathIllegalArgumentException(MyopicFormats.UNPARSABLE_ZERNIKE_MODE, text);
        }
    }


    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ZernikeMode)) return false;
        ZernikeMode mode = (ZernikeMode) other;
        return this.n == mode.n && this.m == mode.m;
    }

    @Override
    public int hashCode() {
        return 31 * this.n + this.m;
    }

    @Override
    public String toString() {
        return label();
    }
}
