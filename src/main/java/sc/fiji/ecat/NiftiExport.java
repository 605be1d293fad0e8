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

import ij.IJ;
import ij.ImagePlus;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.io.SaveDialog;
import ij.measure.Calibration;
import ij.plugin.PlugIn;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * ImageJ plugin to convert the current single-channel hyperstack, such as an ECAT series opened in Fiji,
 * into a NIfTI-1 file with the same rescaling, reorientation and header as an ECAT conversion.
 * Pixel sizes come from the image calibration and frame times from its frame interval.
 */
public class NiftiExport implements PlugIn {
    // Images carry no count rates, so their sub-headers are treated as predating them.
    public static final int IMAGE_SOFTWARE_VERSION = 0;

    private static String timeZero = "";
    private static double calibrationFactor = 1;
    private static boolean compress = false;

    /**
     * The main plugin entry point. Ask for the conversion settings and the file to write.
     * @param arg   The default file name, or empty to use the image title.
     * @see         IJ#runPlugIn(String className, String arg)
     */
    public void run(String arg) {
        ImagePlus imp = WindowManager.getCurrentImage();
        if (imp == null) {
            IJ.noImage();
            return;
        }

        ParsedEcatSource source;
        try {
            source = sourceFromImage(imp);
        } catch (IllegalArgumentException e) {
            new InvalidInputCombinationException(e.getMessage()).report();
            return;
        }

        GenericDialog gd = new GenericDialog("Save NIfTI As...");
        gd.addStringField("TimeZero", timeZero, 20);
        gd.addNumericField("Calibration factor", calibrationFactor, 6, 14, null);
        gd.addCheckbox("Gzip", compress);
        gd.showDialog();
        if (gd.wasCanceled()) return;
        timeZero = gd.getNextString();
        calibrationFactor = gd.getNextNumber();
        compress = gd.getNextBoolean();

        String name = arg;
        if (name == null || name.isEmpty())
            name = imp.getTitle();
        SaveDialog sd = new SaveDialog("Save NIfTI As...", name, ".nii");
        String fileName = sd.getFileName();
        if (fileName == null) return;
        if (compress && !fileName.endsWith(".gz")) fileName += ".gz";

        ConversionOptions options = new ConversionOptions()
                .timeZero(timeZero)
                .calibrationFactor(calibrationFactor)
                .niftiFile(new File(sd.getDirectory(), fileName))
                .compress(compress);
        try {
            new EcatToNiftiConverter().convertAndSave(source, options);
        } catch (IOException e) {
            new EcatConversionException("An error occurred when writing the file: " + e, e).report();
        } catch (EcatConversionException e) {
            e.report();
        }
        IJ.showProgress(1.0);
    }

    /**
     * Describe an image as a parsed ECAT series: one frame per time point, a scale factor of 1,
     * pixel sizes converted to cm and frame times to minutes.
     * @throws IllegalArgumentException When the image has more than one channel.
     */
    static ParsedEcatSource sourceFromImage(ImagePlus imp) {
        VoxelTensor tensor = VoxelTensor.fromImagePlus(imp);
        Calibration cal = imp.getCalibration();
        double toCm = toCentimeters(cal.getUnit());
        double frameMinutes = toSeconds(cal.frameInterval, cal.getTimeUnit()) / FrameScaler.TIME_SCALE;

        List<EcatSubHeader> subHeaders = new ArrayList<>();
        for (int t = 0; t < tensor.getNFrames(); ++t)
            subHeaders.add(new EcatSubHeader(tensor.getWidth(), tensor.getHeight(), tensor.getNSlices(),
                    cal.pixelWidth * toCm, cal.pixelHeight * toCm, cal.pixelDepth * toCm,
                    1, t * frameMinutes, frameMinutes));
        EcatMainHeader mainHeader = new EcatMainHeader(tensor.getNFrames(), IMAGE_SOFTWARE_VERSION, 1);
        if (IJ.debugMode) IJ.log("Image " + imp.getTitle() + " as " + mainHeader + ", " + subHeaders.get(0));
        return new ParsedEcatSource(mainHeader, subHeaders, tensor);
    }

    // Uncalibrated and unknown units are taken as mm.
    static double toCentimeters(String unit) {
        if (unit == null) return 0.1;
        String u = unit.trim().toLowerCase();
        if (u.equals("cm") || u.startsWith("centimet")) return 1;
        if (u.equals("m") || u.startsWith("meter") || u.startsWith("metre")) return 100;
        if (u.equals("um") || u.equals("µm") || u.startsWith("micro")) return 1e-4;
        return 0.1;
    }

    static double toSeconds(double interval, String unit) {
        if (unit == null) return interval;
        String u = unit.trim().toLowerCase();
        if (u.startsWith("min")) return interval * 60;
        if (u.equals("h") || u.startsWith("hour")) return interval * 3600;
        if (u.equals("ms") || u.startsWith("milli")) return interval / 1000;
        return interval;
    }
}
