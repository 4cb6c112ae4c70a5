

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

import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.ImageProcessor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates over the planes of an image, channel first, then z slice, then time frame.
 * A plain 2D image yields a single plane.
 */
class HyperstackPlanes implements Iterable<HyperstackPlanes.Plane> {

    static final String ACQUISITION_DATE_PROPERTY = "AcquisitionDate";

    private static final String CHANNEL_LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final ImagePlus imp;
    private final String image_id;

    HyperstackPlanes(ImagePlus imp) {
        this(imp, imp.getTitle());
    }

    HyperstackPlanes(ImagePlus imp, String image_id) {
        this.imp = imp;
        this.image_id = image_id;
    }


    /** Number of planes the iteration yields */
    int size() {
        return this.imp.getNChannels() * this.imp.getNSlices() * this.imp.getNFrames();
    }


    /**
     * Method to fetch one plane and its metadata.
     *
     * @param c Zero-based channel index
     * @param z Zero-based slice index
     * @param t Zero-based frame index
     * @return The plane
     */
    Plane getPlane(int c, int z, int t) {
        ImageStack stack = this.imp.getStack();
        int stack_index = this.imp.getStackIndex(c + 1, z + 1, t + 1);
        ImageProcessor ip = stack.getProcessor(stack_index);

        Calibration cal = this.imp.getCalibration();
        PlaneMetadata metadata = new PlaneMetadata(this.image_id, c, z, t, channelLabel(c),
                cal.pixelWidth, cal.getUnit(), acquisitionDate());
        return new Plane(ip, metadata);
    }


    public Iterator<Plane> iterator() {
        final int size_c = this.imp.getNChannels();
        final int size_z = this.imp.getNSlices();
        final int size_t = this.imp.getNFrames();

        return new Iterator<Plane>() {
            private int index = 0;

            public boolean hasNext() {
                return this.index < size_c * size_z * size_t;
            }

            public Plane next() {
                if (!hasNext()) throw new NoSuchElementException();
                int c = this.index / (size_z * size_t);
                int z = (this.index / size_t) % size_z;
                int t = this.index % size_t;
                this.index++;
                return getPlane(c, z, t);
            }

            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }


    private String channelLabel(int c) {
        if (c < CHANNEL_LETTERS.length()) return String.valueOf(CHANNEL_LETTERS.charAt(c));
        return "C" + c;
    }


    private String acquisitionDate() {
        Object date = this.imp.getProperty(ACQUISITION_DATE_PROPERTY);
        return (date == null) ? "" : date.toString();
    }


    /**
     * One plane of the image with its metadata
     */
    static class Plane {
        final ImageProcessor ip;
        final PlaneMetadata metadata;

        Plane(ImageProcessor ip, PlaneMetadata metadata) {
            this.ip = ip;
            this.metadata = metadata;
        }
    }
}
