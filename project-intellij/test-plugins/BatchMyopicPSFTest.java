

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchMyopicPSFTest {

    @TempDir
    File folder;

    @Test
    void resultsFileIsNamedAfterTheDay() {
        assertEquals("measures_2023-07-09.csv", BatchMyopicPSF_.csvName(LocalDate.of(2023, 7, 9)));
    }

    @Test
    void onlyTiffFilesAreListedInNameOrder() throws Exception {
        assertTrue(new File(this.folder, "b.tif").createNewFile());
        assertTrue(new File(this.folder, "a.TIFF").createNewFile());
        assertTrue(new File(this.folder, "notes.txt").createNewFile());

        List<String> paths = BatchMyopicPSF_.listImages(this.folder);
        assertEquals(2, paths.size());
        assertTrue(paths.get(0).endsWith("a.TIFF"));
        assertTrue(paths.get(1).endsWith("b.tif"));
    }

    @Test
    void missingFolderGivesNoImages() {
        assertTrue(BatchMyopicPSF_.listImages(new File(this.folder, "absent")).isEmpty());
    }
}
