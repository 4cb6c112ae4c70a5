

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
import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class HyperstackPlanesTest {

    /** A 2 channel, 3 slice, 2 frame hyperstack where each plane is filled with its stack index */
    static ImagePlus hyperstack() {
        ImageStack stack = new ImageStack(8, 8);
        for (int i=1; i<=12; i++) {
            FloatProcessor fp = new FloatProcessor(8, 8);
            fp.setValue(i);
            fp.fill();
            stack.addSlice("plane " + i, fp);
        }
        ImagePlus imp = new ImagePlus("stack", stack);
        imp.setDimensions(2, 3, 2);
        imp.getCalibration().pixelWidth = 0.25;
        imp.getCalibration().setUnit("mm");
        imp.setProperty(HyperstackPlanes.ACQUISITION_DATE_PROPERTY, "2021-03-04T10:00:00");
        return imp;
    }

    @Test
    void planeCountIsTheProductOfDimensions() {
        assertEquals(12, new HyperstackPlanes(hyperstack()).size());
    }

    @Test
    void planesFollowTheStackLayout() {
        ImagePlus imp = hyperstack();
        HyperstackPlanes.Plane plane = new HyperstackPlanes(imp).getPlane(1, 2, 1);
        int expected = imp.getStackIndex(2, 3, 2);
        assertEquals(expected, plane.ip.getf(0, 0), 0.0);
        assertEquals(1, plane.metadata.channel);
        assertEquals(2, plane.metadata.slice);
        assertEquals(1, plane.metadata.frame);
    }

    @Test
    void iterationIsChannelThenSliceThenFrame() {
        List<String> order = new ArrayList<>();
        for (HyperstackPlanes.Plane plane : new HyperstackPlanes(hyperstack())) {
            order.add(plane.metadata.channel + "" + plane.metadata.slice + "" + plane.metadata.frame);
        }
        assertEquals(12, order.size());
        assertEquals("000", order.get(0));
        assertEquals("001", order.get(1));
        assertEquals("010", order.get(2));
        assertEquals("100", order.get(6));
        assertEquals("121", order.get(11));
    }

    @Test
    void metadataComesFromTheImage() {
        HyperstackPlanes.Plane plane = new HyperstackPlanes(hyperstack(), "sample.tif").getPlane(1, 0, 0);
        assertEquals("sample.tif", plane.metadata.image_id);
        assertEquals("B", plane.metadata.channel_label);
        assertEquals(0.25, plane.metadata.pixel_width, 0.0);
        assertEquals("mm", plane.metadata.unit);
        assertEquals("2021-03-04T10:00:00", plane.metadata.acquisition_date);
    }

    @Test
    void singlePlaneImage() {
        ImagePlus imp = new ImagePlus("flat", new FloatProcessor(4, 4));
        Iterator<HyperstackPlanes.Plane> planes = new HyperstackPlanes(imp).iterator();
        HyperstackPlanes.Plane plane = planes.next();
        assertEquals("flat", plane.metadata.image_id);
        assertEquals("", plane.metadata.acquisition_date);
        assertFalse(planes.hasNext());
        assertThrows(NoSuchElementException.class, planes::next);
    }
}
