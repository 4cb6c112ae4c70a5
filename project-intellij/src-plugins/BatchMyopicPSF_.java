

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
import ij.io.DirectoryChooser;
import ij.plugin.PlugIn;

import java.io.File;
import java.io.FilenameFilter;
import java.io.IOException;
import java.text.DecimalFormat;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;


/**
 * An ImageJ plugin to run the myopic PSF estimation on every plane of every TIFF image in a
 * folder. The measurements are appended to a dated CSV file in that folder.
 */
public class BatchMyopicPSF_ implements PlugIn {

    private static final ZernikePolynomials zernike = new ZernikePolynomials();

    private DecimalFormat four_dp = new DecimalFormat("0.0000");


    /**
     * @param arg If <i>defaults</i> then the saved settings are used without a dialog
     */
    public void run(String arg) {
        DirectoryChooser chooser = new DirectoryChooser("Folder of images to measure");
        String directory = chooser.getDirectory();
        if (directory == null) return;

        MyopicSettings settings = MyopicSettings.load();
        if ((arg == null) || !arg.equals("defaults")) {
            if (!settings.showDialog("Batch myopic PSF options", true)) return;
            settings.save();
        }

        List<String> paths = listImages(new File(directory));
        if (paths.isEmpty()) {
            IJ.error("Batch myopic PSF", "No TIFF images in " + directory);
            return;
        }

        MyopicEstimator estimator = new MyopicEstimator(zernike);
        estimator.setLogging(false);
        MeasurementBatch batch = new MeasurementBatch(new MyopicMeasurement(estimator, settings), settings.num_threads);
        batch.setLogging(settings.log_results);

        IJ.showStatus("Measuring " + paths.size() + " images");
        MeasurementBatch.Batch_result result = batch.runOnFiles(paths);

        File csv = new File(directory, csvName(LocalDate.now()));
        try {
            result.saveTo(csv);
        }
        catch (IOException e) {
            IJ.error("Batch myopic PSF", "Could not save " + csv + ":\n" + e.getMessage());
        }

        result.toResultsTable().show("Myopic PSF measurements");
        if (result.getNumFailures() > 0) {
            result.getFailures().show("Myopic PSF failures");
        }

        if (settings.log_results) {
            IJ.log("Batch myopic PSF: " + result.getNumRows() + " planes measured, "
                    + result.getNumFailures() + " images failed, saved to " + csv);
            for (Map.Entry<String, Double> entry : result.summary().entrySet()) {
                IJ.log("Mean " + entry.getKey() + ", " + this.four_dp.format(entry.getValue()));
            }
        }
    }


    /** Method to return the name of the results file for a given day */
    static String csvName(LocalDate date) {
        return "measures_" + date + ".csv";
    }


    /** Method to list the TIFF files of a folder, sorted by name */
    static List<String> listImages(File directory) {
        File[] files = directory.listFiles(new FilenameFilter() {
            public boolean accept(File dir, String name) {
                String lower = name.toLowerCase();
                return lower.endsWith(".tif") || lower.endsWith(".tiff");
            }
        });
        List<String> paths = new ArrayList<>();
        if (files == null) return paths;

        Arrays.sort(files);
        for (File file : files) {
            paths.add(file.getPath());
        }
        return paths;
    }
}
