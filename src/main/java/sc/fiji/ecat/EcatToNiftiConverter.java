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

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Converts an ECAT series into a NIfTI-1 header and a rescaled float tensor.
 * The steps run in order, and the first failure aborts the conversion before anything is produced:
 * <ol>
 *     <li>resolve the source into headers and a tensor,</li>
 *     <li>check the tensor shape against the headers ({@link ShapeReconciler}),</li>
 *     <li>scale and reorient each frame ({@link FrameScaler}),</li>
 *     <li>rescale the whole tensor into physical units ({@link IntensityRescaler}),</li>
 *     <li>derive the header ({@link HeaderSynthesizer}).</li>
 * </ol>
 * A converter holds no state between conversions, so one instance can serve parallel conversions of
 * different files.
 */
public class EcatToNiftiConverter {
    public static final String TIME_ZERO_ADVISORY = "Metadata TimeZero is missing -- set to ScanStart or empty "
            + "to use the scanning time as injection time";

    private final EcatReader reader;
    private final ShapeReconciler reconciler = new ShapeReconciler();
    private final FrameScaler frameScaler = new FrameScaler();
    private final IntensityRescaler rescaler = new IntensityRescaler();
    private final HeaderSynthesizer synthesizer = new HeaderSynthesizer();

    /**
     * A converter for already parsed series only.
     */
    public EcatToNiftiConverter() {
        this(null);
    }

    /**
     * @param reader    Used to read {@link RawEcatSource}s. May be null.
     */
    public EcatToNiftiConverter(EcatReader reader) {
        this.reader = reader;
    }

    /**
     * @param source    The series to convert.
     * @param options   The conversion settings, or null for the defaults.
     * @return          The header, the rescaled tensor and the frame timings.
     * @throws EcatConversionException  When the input is invalid. See its subclasses.
     * @throws IllegalArgumentException When the affine option is not a 3x4 or 4x4 matrix.
     * @throws IOException              When reading a raw ECAT file fails.
     */
    public ConversionResult convert(EcatSource source, ConversionOptions options) throws IOException {
        if (source == null)
            throw new InvalidInputCombinationException("Must pass in a file path for the ECAT file "
                    + "or the ECAT main header, sub-headers and pixel data.");
        if (options == null) options = new ConversionOptions();
        if (options.affine != null) HeaderSynthesizer.checkAffine(options.affine);

        ParsedEcatSource parsed = source.resolve(reader);
        if (IJ.debugMode) IJ.log("Converting " + parsed + " with " + options);
        if (options.timeZero == null || options.timeZero.isEmpty())
            IJ.log(TIME_ZERO_ADVISORY);

        EcatMainHeader mainHeader = parsed.getMainHeader();
        List<EcatSubHeader> subHeaders = parsed.getSubHeaders();
        VoxelTensor raw = parsed.getTensor();

        int[] declared = ShapeReconciler.declaredShape(mainHeader, subHeaders);
        reconciler.reconcile(declared, raw.shape());
        raw.requireFinite("ECAT pixel data");

        VoxelTensor scaled = VoxelTensor.allocate(declared[0], declared[1], declared[2], declared[3]);
        FrameTimings timings = frameScaler.scale(mainHeader, subHeaders, raw, scaled);

        double calibrationFactor = options.calibrationFactor != null
                ? options.calibrationFactor : mainHeader.calibrationFactor;
        RescaleResult rescale = rescaler.rescale(scaled, calibrationFactor);

        NiftiHeader header = synthesizer.synthesize(subHeaders.get(0), scaled.shape(), rescale, options.affine);
        IJ.showStatus("");
        return new ConversionResult(header, scaled, rescale, timings, options.timeZero, parsed.getFile(),
                options.customFields);
    }

    /**
     * Convert the series and write it as a single NIfTI-1 file.
     * @return  The conversion result. Its file was written to the options' file,
     *          or next to the ECAT file when no file was given.
     * @throws InvalidInputCombinationException When there is neither an output file nor an ECAT file to place it by.
     * @throws IOException  When reading or writing fails.
     * @see #convert(EcatSource, ConversionOptions)
     */
    public ConversionResult convertAndSave(EcatSource source, ConversionOptions options) throws IOException {
        if (options == null) options = new ConversionOptions();
        File niftiFile = options.niftiFile;
        if (niftiFile == null) {
            if (source == null || source.getFile() == null)
                throw new InvalidInputCombinationException("No NIfTI file given, and no ECAT file to write it next to.");
            niftiFile = defaultNiftiFile(source.getFile(), options.compress);
        }
        ConversionResult result = convert(source, options);
        new NiftiWriter().write(result, niftiFile, options.compress);
        IJ.showStatus("Saved " + niftiFile.getName());
        return result;
    }

    /**
     * @return  The ECAT file's path with its extension replaced by .nii, or .nii.gz when compressing.
     */
    public static File defaultNiftiFile(File ecatFile, boolean compress) {
        String name = ecatFile.getName();
        int i = name.lastIndexOf('.');
        if (i > 0) name = name.substring(0, i);
        name += compress ? ".nii.gz" : ".nii";
        return new File(ecatFile.getParentFile(), name);
    }
}
