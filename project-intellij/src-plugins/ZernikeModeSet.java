

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered, duplicate-free list of Zernike modes. The order defines which amplitude in a
 * parameter vector belongs to which mode.
 */
public final class ZernikeModeSet implements Iterable<ZernikeMode> {

    /** Oblique astigmatism, vertical astigmatism and primary spherical aberration */
    static final ZernikeModeSet ASTIGMATISM_AND_SPHERICAL = new ZernikeModeSet(
            new ZernikeMode(2, -2), new ZernikeMode(2, 2), new ZernikeMode(4, 0));

    private final List<ZernikeMode> modes;

    public ZernikeModeSet(ZernikeMode... modes) {
        this(Arrays.asList(modes));
    }

    public ZernikeModeSet(List<ZernikeMode> modes) {
        List<ZernikeMode> copy = new ArrayList<>(modes.size());
        for (ZernikeMode mode : modes) {
            if (copy.contains(mode)) {
                throw new MathIllegalArgumentException(MyopicFormats.DUPLICATE_ZERNIKE_MODE, mode.label());
            }
            copy.add(mode);
        }
        this.modes = Collections.unmodifiableList(copy);
    }


    /**
     * Method to list every valid mode up to a maximum radial degree, in OSA/ANSI order
     * (n ascending, then m from -n to n).
     *
     * @param max_n The highest radial degree to include
     * @return The modes, the first one being the piston (0, 0)
     */
    static ZernikeModeSet upTo(int max_n) {
        List<ZernikeMode> modes = new ArrayList<>();
        for (int n=0; n<=max_n; n++) {
            for (int m=-n; m<=n; m+=2) {
                modes.add(new ZernikeMode(n, m));
            }
        }
        return new ZernikeModeSet(modes);
    }


    /**
     * Method to read a mode set from text such as "2,-2; 2,2; 4,0".
     *
     * @param text Modes separated by semicolons
     * @return The mode set, in the order given
     */
    static ZernikeModeSet parse(String text) {
        List<ZernikeMode> modes = new ArrayList<>();
        for (String token : text.split(";")) {
            if (token.trim().isEmpty()) continue;
            modes.add(ZernikeMode.parse(token));
        }
        return new ZernikeModeSet(modes);
    }


    /** Method to return the modes with the piston (0, 0) in front, as used by the transfer function
     *
     * @return A new list starting with the piston mode
     */
    List<ZernikeMode> withPiston() {
        List<ZernikeMode> result = new ArrayList<>(this.modes.size() + 1);
        result.add(ZernikeMode.PISTON);
        result.addAll(this.modes);
        return result;
    }


    int size() { return this.modes.size(); }
    ZernikeMode get(int index) { return this.modes.get(index); }
    int indexOf(ZernikeMode mode) { return this.modes.indexOf(mode); }
    List<ZernikeMode> asList() { return this.modes; }

    public Iterator<ZernikeMode> iterator() {
        return this.modes.iterator();
    }


    /** Method to format the set the way {@link #parse(String)} reads it
     *
     * @return e.g. "2,-2; 2,2; 4,0"
     */
    String format() {
        StringBuilder text = new StringBuilder();
        for (ZernikeMode mode : this.modes) {
            if (text.length() > 0) text.append("; ");
            text.append(mode.getN()).append(",").append(mode.getM());
        }
        return text.toString();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ZernikeModeSet && this.modes.equals(((ZernikeModeSet) other).modes);
    }

    @Override
    public int hashCode() {
        return this.modes.hashCode();
    }

    @Override
    public String toString() {
        return this.modes.toString();
    }
}
