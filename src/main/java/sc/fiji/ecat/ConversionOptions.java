/*-
 * #%L
 * ECAT to NIfTI conversion for Fiji.
 * %%
 * Copyright (C) 2008 - 2023 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.ecat;

import java.io.File;
import java.util.HashMap;

/**
 * Caller supplied settings of one conversion. Every field is optional.
 */
public class ConversionOptions {
    // A 3x4 or 4x4 voxel to scanner matrix used instead of the derived one.
    public double[][] affine = null;
    // The injection time. Only its presence is checked.
    public String timeZero = null;
    // Overrides the main header's calibration factor when set.
    public Double calibrationFactor = null;
    // Where to write the NIfTI file. Defaults to the ECAT file's path with a .nii extension.
    public File niftiFile = null;
    // Write a gzip compressed .nii.gz file.
    public boolean compress = false;
    // Key/value pairs which are carried into the result without being interpreted.
    public HashMap<String, String> customFields = new HashMap<>();

    public ConversionOptions() {
    }

    public ConversionOptions affine(double[][] affine) {
        this.affine = affine;
        return this;
    }

    public ConversionOptions timeZero(String timeZero) {
        this.timeZero = timeZero;
        return this;
    }

    public ConversionOptions calibrationFactor(Double calibrationFactor) {
        this.calibrationFactor = calibrationFactor;
        return this;
    }

    public ConversionOptions niftiFile(File niftiFile) {
        this.niftiFile = niftiFile;
        return this;
    }

    public ConversionOptions compress(boolean compress) {
        this.compress = compress;
        return this;
    }

    public ConversionOptions customField(String key, String value) {
        customFields.put(key, value);
        return this;
    }

    public String toString() {
        return "ConversionOptions(affine=" + (affine != null)
                + ", timeZero=" + timeZero
                + ", calibrationFactor=" + calibrationFactor
                + ", niftiFile=" + niftiFile
                + ", compress=" + compress
                + ", customFields=" + customFields
                + ")";
    }
}
