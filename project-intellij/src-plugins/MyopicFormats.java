

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

import org.apache.commons.math3.exception.util.Localizable;

import java.util.Locale;

/**
 * Message patterns for the exceptions raised by the myopic PSF estimation classes.
 * They plug into the commons-math3 exception context, so the messages are formatted
 * the same way as the library's own.
 */
enum MyopicFormats implements Localizable {

    INVALID_ZERNIKE_MODE("invalid Zernike mode ({0}, {1}): {2}"),
    DUPLICATE_ZERNIKE_MODE("Zernike mode {0} is listed more than once"),
    UNPARSABLE_ZERNIKE_MODE("cannot read a Zernike mode from \"{0}\""),
    NO_POSITIVE_WEIGHT("none of the {0} spectral weights is strictly positive, the geometric mean is undefined"),
    ZERO_ENERGY_TRANSFER_FUNCTION("the transfer function sums to {0} and cannot be energy normalised"),
    NON_FINITE_COST("the generalised likelihood evaluated to {0}"),
    NO_DEFINED_COST("the generalised likelihood was undefined at all {0} trial points"),
    UNKNOWN_PARAMETER("unknown parameter \"{0}\", expected alpha, beta, resolution or one of {1}"),
    MODE_SET_MISMATCH("the parameters are defined on the modes {0} but the criterion on {1}"),
    EMPTY_IMAGE("the image has no pixels");

    private final String source_format;

    MyopicFormats(String source_format) {
        this.source_format = source_format;
    }

    public String getSourceString() {
        return this.source_format;
    }

    // Only English messages are provided
    public String getLocalizedString(Locale locale) {
        return this.source_format;
    }
}
