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

import ij.ImagePlus;
import ij.measure.Calibration;

import java.io.File;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A converted series: the NIfTI header, the rescaled tensor in physical units, the rescale factors
 * and the per-frame timings. Handed over to the caller, which owns it from then on.
 */
public class ConversionResult {
    public static final String QUANTITATIVE_FACTOR_PROPERTY = "ECAT quantitative factor";
    public static final String TIME_ZERO_PROPERTY = "TimeZero";

    private final NiftiHeader header;
    private final VoxelTensor tensor;
    private final RescaleResult rescale;
    private final FrameTimings timings;
    private final String timeZero;
    private final File sourceFile;
    private final Map<String, String> customFields;

    ConversionResult(NiftiHeader header, VoxelTensor tensor, RescaleResult rescale, FrameTimings timings,
                     String timeZero, File sourceFile, Map<String, String> customFields) {
        this.header = header;
        this.tensor = tensor;
        this.rescale = rescale;
        this.timings = timings;
        this.timeZero = timeZero;
        this.sourceFile = sourceFile;
        this.customFields = customFields == null
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(customFields));
    }

    public NiftiHeader getHeader() {
        return header;
    }

    public VoxelTensor getTensor() {
        return tensor;
    }

    public RescaleResult getRescale() {
        return rescale;
    }

    /**
     * @return  scale * calibration factor. Dividing a stored value by it gives back the 16-bit compatible value.
     * @see RescaleResult#quantitativeFactor()
     */
    public double getQuantitativeFactor() {
        return rescale.quantitativeFactor();
    }

    public FrameTimings getTimings() {
        return timings;
    }

    /**
     * @return  The injection time given by the caller, or null.
     */
    public String getTimeZero() {
        return timeZero;
    }

    /**
     * @return  The ECAT file the series was read from, or null when it was passed in already parsed.
     */
    public File getSourceFile() {
        return sourceFile;
    }

    public Map<String, String> getCustomFields() {
        return customFields;
    }

    /**
     * Present the converted data as a hyperstack, calibrated in mm with its origin at the sform translation.
     * The image shares its pixels with this result.
     */
    public ImagePlus toImagePlus(String title) {
        ImagePlus imp = tensor.toImagePlus(title);
        Calibration cal = imp.getLocalCalibration();
        cal.setUnit("mm");
        cal.pixelWidth = header.pixdim[1];
        cal.pixelHeight = header.pixdim[2];
        cal.pixelDepth = header.pixdim[3];
        if (header.pixdim[1] != 0) cal.xOrigin = -header.srowX[3] / header.pixdim[1];
        if (header.pixdim[2] != 0) cal.yOrigin = -header.srowY[3] / header.pixdim[2];
        if (header.pixdim[3] != 0) cal.zOrigin = -header.srowZ[3] / header.pixdim[3];
        cal.setTimeUnit("sec");
        cal.info = header.descrip;

        imp.setProperty("Info", header.toString());
        imp.setProperty(QUANTITATIVE_FACTOR_PROPERTY, String.valueOf(getQuantitativeFactor()));
        if (timeZero != null) imp.setProperty(TIME_ZERO_PROPERTY, timeZero);
        for (Map.Entry<String, String> field : customFields.entrySet())
            imp.setProperty(field.getKey(), field.getValue());
        imp.getProcessor().setMinAndMax(rescale.min, rescale.max);
        return imp;
    }

    public String toString() {
        return "ConversionResult(header=" + header
                + ", tensor=" + tensor
                + ", rescale=" + rescale
                + ", timings=" + timings
                + ", timeZero=" + timeZero
                + ", sourceFile=" + sourceFile
                + ", customFields=" + customFields
                + ")";
    }
}
