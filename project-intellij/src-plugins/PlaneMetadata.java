

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

/**
 * Where a plane comes from and how it was sampled. Indices are zero-based.
 */
final class PlaneMetadata {

    final String image_id;
    final int channel;
    final int slice;
    final int frame;
    final String channel_label;
    final double pixel_width;
    final String unit;
    final String acquisition_date;

    PlaneMetadata(String image_id, int channel, int slice, int frame, String channel_label,
                  double pixel_width, String unit, String acquisition_date) {
        this.image_id = image_id;
        this.channel = channel;
        this.slice = slice;
        this.frame = frame;
        this.channel_label = channel_label;
        this.pixel_width = pixel_width;
        this.unit = unit;
        this.acquisition_date = acquisition_date;
    }

    @Override
    public String toString() {
        return this.image_id + " [c=" + this.channel + ", z=" + this.slice + ", t=" + this.frame + "]";
    }
}
