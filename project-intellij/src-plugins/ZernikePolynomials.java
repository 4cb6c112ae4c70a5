

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

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.util.CombinatoricsUtils;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evaluates Zernike polynomials on a polar grid.
 * <br><br>
 * Z<sub>n</sub><sup>m</sup>(&rho;, &phi;) = R<sub>n</sub><sup>|m|</sup>(&rho;).cos(m.&phi;) for m &ge; 0, and
 * R<sub>n</sub><sup>|m|</sup>(&rho;).sin(|m|.&phi;) for m &lt; 0, where the radial polynomial is
 * <pre>
 *
 *                      (n-m)/2        k
 *  R<sub>n</sub><sup>m</sup>(&rho;) =    &Sigma;      (-1)  (n-k)! / (k! ((n+m)/2-k)! ((n-m)/2-k)!) &rho;<sup>n-2k</sup>
 *                       k=0
 * </pre>
 * The radial polynomials are built once per (n, |m|) and kept for the lifetime of this object,
 * keyed by the OSA/ANSI index (n(n+2)+m)/2. The cache can be read and filled from several
 * threads: a polynomial computed twice is identical, so whichever copy is stored first wins.
 * <br><br>
 * See <a href="https://en.wikipedia.org/wiki/Zernike_polynomials">https://en.wikipedia.org/wiki/Zernike_polynomials</a>
 */
public class ZernikePolynomials {

    private final ConcurrentMap<Integer, PolynomialFunction> radial_polynomials = new ConcurrentHashMap<>();

    private final AtomicLong cache_hits = new AtomicLong();
    private final AtomicLong computed_count = new AtomicLong();


    /** Method to return the OSA/ANSI standard index of a mode
     *
     * @param n Radial degree
     * @param m Azimuthal frequency
     * @return (n(n+2)+m)/2
     */
    static int standardIndex(int n, int m) {
        return (n * (n + 2) + m) / 2;
    }


    /**
     * Method to check the index rules that every call must satisfy: n &ge; 0 and |m| &le; n.
     * The parity of n - m is not checked here because an odd pair is a valid request for
     * {@link #evaluate}, which returns zeros for it.
     */
    static void checkIndices(int n, int m) {
        if (n < 0) {
            throw new InvalidZernikeModeException(n, m, "n must not be negative");
        }
        if (Math.abs(m) > n) {
            throw new InvalidZernikeModeException(n, m, "|m| must not exceed n");
        }
    }


    /**
     * Method to evaluate one Zernike polynomial at every point of a polar grid.
     *
     * @param n Radial degree
     * @param m Azimuthal frequency; negative values select the sine term
     * @param rho Radial coordinate of every grid point
     * @param phi Angular coordinate of every grid point, same dimensions as rho
     * @return Array with the dimensions of rho. All zeros when n - m is odd.
     * @throws InvalidZernikeModeException if n &lt; 0 or |m| &gt; n
     * @throws DimensionMismatchException if rho and phi differ in size
     */
    double[][] evaluate(int n, int m, double[][] rho, double[][] phi) {
        checkIndices(n, m);
        checkSameShape(rho, phi);

        double[][] result = new double[rho.length][rho.length == 0 ? 0 : rho[0].length];
        if ((n - m) % 2 != 0) {
            return result;
        }

        int abs_m = Math.abs(m);
        PolynomialFunction radial = radialPolynomial(n, abs_m);

        for (int i=0; i<rho.length; i++) {
            for (int j=0; j<rho[i].length; j++) {
                double angular = (m >= 0) ? Math.cos(m * phi[i][j]) : Math.sin(abs_m * phi[i][j]);
                result[i][j] = radial.value(rho[i][j]) * angular;
            }
        }
        return result;
    }


    /**
     * Method to return the radial polynomial R<sub>n</sub><sup>m</sup>, computing and caching it on first use.
     *
     * @param n Radial degree
     * @param m Azimuthal frequency, 0 &le; m &le; n with n - m even
     * @return The polynomial, with coefficients in increasing powers of &rho;
     * @throws InvalidZernikeModeException if the pair breaks the rules above
     */
    PolynomialFunction radialPolynomial(int n, int m) {
        checkIndices(n, m);
        if (m < 0) {
            throw new InvalidZernikeModeException(n, m, "the radial polynomial is indexed by |m|");
        }
        if ((n - m) % 2 != 0) {
            throw new InvalidZernikeModeException(n, m, "n - m must be even");
        }

        int key = standardIndex(n, m);
        PolynomialFunction cached = this.radial_polynomials.get(key);
        if (cached != null) {
            this.cache_hits.incrementAndGet();
            return cached;
        }

        double[] factors = radialFactors(n, m);
        double[] coefficients = new double[n + 1];
        for (int k=0; k<factors.length; k++) {
            coefficients[n - 2 * k] = factors[k];
        }
        PolynomialFunction computed = new PolynomialFunction(coefficients);
        this.computed_count.incrementAndGet();

        PolynomialFunction previous = this.radial_polynomials.putIfAbsent(key, computed);
        return (previous == null) ? computed : previous;
    }


    /**
     * Method to calculate the factors of the radial polynomial, one per power n - 2k of &rho;.
     */
    static double[] radialFactors(int n, int m) {
        int num_terms = (n - m) / 2 + 1;
        double[] factors = new double[num_terms];
        for (int k=0; k<num_terms; k++) {
            double sign = (k % 2 == 0) ? 1.0 : -1.0;
            factors[k] = sign * CombinatoricsUtils.factorialDouble(n - k)
                    / (CombinatoricsUtils.factorialDouble(k)
                    * CombinatoricsUtils.factorialDouble((n + m) / 2 - k)
                    * CombinatoricsUtils.factorialDouble((n - m) / 2 - k));
        }
        return factors;
    }


    /** Number of radial polynomial requests answered from the cache */
    long getCacheHits() { return this.cache_hits.get(); }

    /** Number of radial polynomials that had to be computed */
    long getComputedCount() { return this.computed_count.get(); }

    /** Number of distinct radial polynomials held */
    int getCacheSize() { return this.radial_polynomials.size(); }


    private static void checkSameShape(double[][] rho, double[][] phi) {
        if (rho.length != phi.length) {
            throw new DimensionMismatchException(phi.length, rho.length);
        }
        for (int i=0; i<rho.length; i++) {
            if (rho[i].length != phi[i].length) {
                throw new DimensionMismatchException(phi[i].length, rho[i].length);
            }
        }
    }
}
