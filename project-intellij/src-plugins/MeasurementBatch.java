

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

import ij.IJ;
import ij.ImagePlus;
import ij.measure.ResultsTable;
import org.apache.commons.math3.stat.StatUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a {@link PlaneMeasurement} over every plane of a list of images. Images are measured in
 * parallel, one task per image; the planes of an image are measured one after the other and its
 * rows are added to the table together, so that a failing image leaves no partial rows.
 */
class MeasurementBatch {

    static final String IMAGE = "Image";
    static final String CHANNEL = "C";
    static final String SLICE = "Z";
    static final String FRAME = "T";
    static final String CHANNEL_LABEL = "ChannelLabel";
    static final String PIXEL_WIDTH = "PixelWidth";
    static final String UNIT = "Unit";
    static final String ACQUISITION_DATE = "AcquisitionDate";
    static final String MEASUREMENT = "Measurement";
    static final String ERROR = "Error";

    private final PlaneMeasurement measurement;
    private final int num_threads;
    private boolean log_results = true;


    MeasurementBatch(PlaneMeasurement measurement, int num_threads) {
        this.measurement = measurement;
        this.num_threads = Math.max(1, num_threads);
    }


    void setLogging(boolean log_condition) {
        this.log_results = log_condition;
    }


    /**
     * Method to open and measure a list of image files. A file that cannot be opened is recorded
     * as a failure.
     *
     * @param paths Image file paths
     * @return The measurements and failures
     */
    Batch_result runOnFiles(List<String> paths) {
        List<Runnable> tasks = new ArrayList<>();
        List<String> image_ids = new ArrayList<>();
        final Batch_result result = new Batch_result();
        for (final String path : paths) {
            image_ids.add(new File(path).getName());
            tasks.add(new Runnable() {
                public void run() {
                    String image_id = new File(path).getName();
                    ImagePlus imp = IJ.openImage(path);
                    if (imp == null) {
                        result.recordFailure(image_id, "Could not open " + path);
                        return;
                    }
                    measureImage(image_id, imp, result);
                    imp.close();
                }
            });
        }
        execute(tasks, image_ids, result);
        return result;
    }


    /**
     * Method to measure images that are already open. Each image is identified by its title.
     *
     * @param images The images to measure
     * @return The measurements and failures
     */
    Batch_result runOnImages(List<ImagePlus> images) {
        List<Runnable> tasks = new ArrayList<>();
        List<String> image_ids = new ArrayList<>();
        final Batch_result result = new Batch_result();
        for (final ImagePlus imp : images) {
            image_ids.add(imp.getTitle());
            tasks.add(new Runnable() {
                public void run() {
                    measureImage(imp.getTitle(), imp, result);
                }
            });
        }
        execute(tasks, image_ids, result);
        return result;
    }


    private void execute(List<Runnable> tasks, List<String> image_ids, Batch_result result) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(this.num_threads, Math.max(1, tasks.size())));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Runnable task : tasks) {
                futures.add(executor.submit(task));
            }
            for (int i=0; i<futures.size(); i++) {
                try {
                    futures.get(i).get();
                }
                catch (ExecutionException e) {
                    result.recordFailure(image_ids.get(i), String.valueOf(e.getCause()));
                }
                IJ.showProgress(i + 1, futures.size());
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            IJ.log("Measurement batch interrupted");
        }
        finally {
            executor.shutdownNow();
        }
    }


    /**
     * Method to measure every plane of one image. Any error aborts the image and is recorded
     * against it.
     */
    void measureImage(String image_id, ImagePlus imp, Batch_result result) {
        List<Measured_plane> rows = new ArrayList<>();
        try {
            for (HyperstackPlanes.Plane plane : new HyperstackPlanes(imp, image_id)) {
                Map<String, Double> values = this.measurement.measure(plane.ip, plane.metadata);
                rows.add(new Measured_plane(plane.metadata, values));
            }
        }
        catch (RuntimeException e) {
            result.recordFailure(image_id, e.getClass().getSimpleName() + ": " + e.getMessage());
            if (this.log_results) {
                IJ.log("Failed to measure " + image_id + ": " + e.getMessage());
            }
            return;
        }
        result.append(this.measurement.getName(), rows);
        if (this.log_results) {
            IJ.log("Measured " + rows.size() + " plane(s) of " + image_id);
        }
    }


    /**
     * Definition of a Measured_plane class holding the result of one plane
     */
    static class Measured_plane {
        final PlaneMetadata metadata;
        final Map<String, Double> values;

        Measured_plane(PlaneMetadata metadata, Map<String, Double> values) {
            this.metadata = metadata;
            this.values = values;
        }
    }


    /**
     * Definition of a Batch_result class collecting the rows of all images. Methods are
     * synchronised since the images are measured concurrently.
     */
    static class Batch_result {
        private final List<Measured_plane> rows = new ArrayList<>();
        private final List<String> measurement_names = new ArrayList<>();
        private final ResultsTable failures = new ResultsTable();

        synchronized void append(String measurement_name, List<Measured_plane> image_rows) {
            for (Measured_plane row : image_rows) {
                this.rows.add(row);
                this.measurement_names.add(measurement_name);
            }
        }

        synchronized void recordFailure(String image_id, String message) {
            this.failures.incrementCounter();
            this.failures.addValue(IMAGE, image_id);
            this.failures.addValue(ERROR, message);
        }

        synchronized int getNumRows() { return this.rows.size(); }
        synchronized int getNumFailures() { return this.failures.getCounter(); }
        synchronized ResultsTable getFailures() { return this.failures; }

        /** Method to return a copy of the measured rows */
        synchronized List<Measured_plane> getRows() {
            return new ArrayList<>(this.rows);
        }

        /**
         * Method to return the mean of each measured value over all rows. Failed images have no
         * rows and do not contribute.
         */
        synchronized Map<String, Double> summary() {
            Set<String> keys = new LinkedHashSet<>();
            for (Measured_plane row : this.rows) {
                keys.addAll(row.values.keySet());
            }
            Map<String, Double> means = new LinkedHashMap<>();
            for (String key : keys) {
                List<Double> column = new ArrayList<>();
                for (Measured_plane row : this.rows) {
                    Double value = row.values.get(key);
                    if (value != null) column.add(value);
                }
                double[] values = new double[column.size()];
                for (int i=0; i<values.length; i++) values[i] = column.get(i);
                means.put(key, StatUtils.mean(values));
            }
            return means;
        }

        /** Method to return the rows as a new results table */
        synchronized ResultsTable toResultsTable() {
            ResultsTable table = new ResultsTable();
            appendTo(table);
            return table;
        }

        /** Method to add the rows at the end of an existing table */
        synchronized void appendTo(ResultsTable table) {
            for (int i=0; i<this.rows.size(); i++) {
                Measured_plane row = this.rows.get(i);
                PlaneMetadata metadata = row.metadata;
                table.incrementCounter();
                table.addValue(IMAGE, metadata.image_id);
                table.addValue(CHANNEL, metadata.channel);
                table.addValue(SLICE, metadata.slice);
                table.addValue(FRAME, metadata.frame);
                table.addValue(CHANNEL_LABEL, metadata.channel_label);
                table.addValue(PIXEL_WIDTH, metadata.pixel_width);
                table.addValue(UNIT, metadata.unit);
                table.addValue(ACQUISITION_DATE, metadata.acquisition_date);
                table.addValue(MEASUREMENT, this.measurement_names.get(i));
                for (Map.Entry<String, Double> entry : row.values.entrySet()) {
                    table.addValue(entry.getKey(), entry.getValue());
                }
            }
        }

        /**
         * Method to save the rows to a CSV file. If the file exists its rows are kept and the new
         * rows are added after them.
         *
         * @param csv The file to write
         * @throws IOException if the existing file cannot be read or the file cannot be written
         */
        synchronized void saveTo(File csv) throws IOException {
            ResultsTable table = csv.exists() ? ResultsTable.open(csv.getPath()) : new ResultsTable();
            appendTo(table);
            table.saveAs(csv.getPath());
        }
    }
}
