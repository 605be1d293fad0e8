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

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.ImagePlus;

public class EcatToNiftiConverterTest {
    static final int W = 4;
    static final int H = 3;
    static final int D = 2;
    static final int FRAMES = 2;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private EcatReader reader;

    @Before
    public void setUp() throws Exception {
        reader = mock(EcatReader.class);
    }

    static EcatMainHeader mainHeader() {
        return new EcatMainHeader(FRAMES, 73, 2.5);
    }

    static List<EcatSubHeader> subHeaders() {
        List<EcatSubHeader> subs = new ArrayList<>();
        for (int t = 0; t < FRAMES; ++t)
            subs.add(new EcatSubHeader(W, H, D, 0.2, 0.2, 0.3, t + 1, t, 1, 100, 10));
        return subs;
    }

    /**
     * Voxel values 1 + x + 10 y + 100 z + 1000 t.
     */
    static VoxelTensor rawTensor() {
        VoxelTensor tensor = VoxelTensor.allocate(W, H, D, FRAMES);
        for (int t = 0; t < FRAMES; ++t)
            for (int z = 0; z < D; ++z)
                for (int y = 0; y < H; ++y)
                    for (int x = 0; x < W; ++x)
                        tensor.set(x, y, z, t, 1 + x + 10 * y + 100 * z + 1000 * t);
        return tensor;
    }

    static ParsedEcatSource parsedSource() {
        return new ParsedEcatSource(mainHeader(), subHeaders(), rawTensor());
    }

    @Test
    public void testConvertParsedSeries() throws IOException {
        ConversionResult result = new EcatToNiftiConverter().convert(parsedSource(),
                new ConversionOptions().timeZero("10:00:00"));

        NiftiHeader hdr = result.getHeader();
        assertArrayEquals(new int[] {W, H, D, FRAMES}, hdr.shape());
        assertArrayEquals(new int[] {W, H, D, FRAMES}, result.getTensor().shape());
        assertEquals(2.0f, hdr.pixdim[1], 1e-6f);
        assertEquals(3.0f, hdr.pixdim[3], 1e-6f);
        assertEquals(2.5, result.getRescale().calibrationFactor, 0.0);
        assertEquals("10:00:00", result.getTimeZero());
        assertNull(result.getSourceFile());

        // Every stored value is the frame scaled, reoriented raw value times one global factor.
        VoxelTensor raw = rawTensor();
        double factor = result.getTensor().get(0, 0, 0, 0) / (raw.get(W - 1, H - 1, D - 1, 0) * 1.0);
        for (int t = 0; t < FRAMES; ++t)
            for (int z = 0; z < D; ++z)
                for (int y = 0; y < H; ++y)
                    for (int x = 0; x < W; ++x) {
                        double expected = raw.get(W - 1 - x, H - 1 - y, D - 1 - z, t) * (t + 1) * factor;
                        assertEquals(expected, result.getTensor().get(x, y, z, t), Math.abs(expected) * 1e-5);
                    }
        assertEquals(result.getRescale().max, hdr.calMin, 0f);
        assertEquals(result.getRescale().min, hdr.calMax, 0f);
    }

    @Test
    public void testTimingsAreCollected() throws IOException {
        FrameTimings timings = new EcatToNiftiConverter().convert(parsedSource(), null).getTimings();
        assertEquals(Arrays.asList(0.0, 60.0), timings.getStarts());
        assertEquals(Arrays.asList(60.0, 60.0), timings.getDurations());
        assertEquals(Arrays.asList(6000.0, 6000.0), timings.getPrompts());
        assertEquals(Arrays.asList(600.0, 600.0), timings.getRandoms());
    }

    @Test
    public void testCalibrationFactorOverride() throws IOException {
        ConversionResult plain = new EcatToNiftiConverter().convert(parsedSource(), null);
        ConversionResult overridden = new EcatToNiftiConverter().convert(parsedSource(),
                new ConversionOptions().calibrationFactor(5.0));
        assertEquals(5.0, overridden.getRescale().calibrationFactor, 0.0);
        assertEquals(2 * plain.getQuantitativeFactor(), overridden.getQuantitativeFactor(), 1e-12);
        assertEquals(2 * plain.getTensor().get(1, 1, 1, 1), overridden.getTensor().get(1, 1, 1, 1), 1e-9);
    }

    @Test
    public void testAffineOverride() throws IOException {
        double[][] affine = {{1, 0, 0, -10}, {0, 1, 0, -20}, {0, 0, 1, -30}};
        NiftiHeader hdr = new EcatToNiftiConverter().convert(parsedSource(),
                new ConversionOptions().affine(affine)).getHeader();
        assertArrayEquals(new float[] {1, 0, 0, -10}, hdr.srowX, 0f);
        assertEquals(-30f, hdr.qoffsetZ, 0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedAffineFailsBeforeReading() throws IOException {
        File ecat = folder.newFile("scan.v");
        try {
            new EcatToNiftiConverter(reader).convert(new RawEcatSource(ecat),
                    new ConversionOptions().affine(new double[][] {{1, 2}}));
        } finally {
            verifyNoInteractions(reader);
        }
    }

    @Test
    public void testRawSourceIsReadWithReader() throws IOException {
        File ecat = folder.newFile("scan.v");
        when(reader.read(ecat)).thenReturn(parsedSource());

        ConversionResult result = new EcatToNiftiConverter(reader).convert(new RawEcatSource(ecat), null);

        verify(reader).read(ecat);
        assertEquals(ecat, result.getSourceFile());
        assertArrayEquals(new int[] {W, H, D, FRAMES}, result.getHeader().shape());
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testRawSourceWithoutReader() throws IOException {
        new EcatToNiftiConverter().convert(new RawEcatSource(folder.newFile("scan.v")), null);
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testMissingFile() throws IOException {
        new EcatToNiftiConverter(reader).convert(new RawEcatSource(new File(folder.getRoot(), "missing.v")), null);
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testNullPath() throws IOException {
        new EcatToNiftiConverter(reader).convert(new RawEcatSource((String) null), null);
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testNullSource() throws IOException {
        new EcatToNiftiConverter(reader).convert(null, null);
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testPartialParsedSource() throws IOException {
        new EcatToNiftiConverter().convert(new ParsedEcatSource(mainHeader(), subHeaders(), null), null);
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testTooFewSubHeaders() throws IOException {
        new EcatToNiftiConverter().convert(
                new ParsedEcatSource(mainHeader(), subHeaders().subList(0, 1), rawTensor()), null);
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testNoSubHeaders() throws IOException {
        new EcatToNiftiConverter().convert(
                new ParsedEcatSource(mainHeader(), Collections.<EcatSubHeader>emptyList(), rawTensor()), null);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testShapeMismatch() throws IOException {
        new EcatToNiftiConverter().convert(
                new ParsedEcatSource(new EcatMainHeader(3, 73, 1), subHeaders(), rawTensor()), null);
    }

    @Test
    public void testSingleFrameIsBroadcast() throws IOException {
        VoxelTensor raw = VoxelTensor.allocate(W, H, 1, 1);
        raw.set(0, 0, 0, 0, 5);
        EcatSubHeader sub = new EcatSubHeader(W, H, D, 0.2, 0.2, 0.3, 1, 0, 1);

        ConversionResult result = new EcatToNiftiConverter().convert(
                new ParsedEcatSource(new EcatMainHeader(1, 72, 1), Collections.singletonList(sub), raw), null);

        assertArrayEquals(new int[] {W, H, D, 1}, result.getTensor().shape());
        for (int z = 0; z < D; ++z)
            assertEquals(result.getRescale().max, result.getTensor().get(W - 1, H - 1, z, 0), 0f);
    }

    @Test
    public void testNonFiniteInputIsRejectedBeforeScaling() throws IOException {
        VoxelTensor raw = rawTensor();
        raw.set(1, 2, 1, 0, Float.NaN);
        try {
            new EcatToNiftiConverter().convert(new ParsedEcatSource(mainHeader(), subHeaders(), raw), null);
            fail("A NaN voxel must be rejected.");
        } catch (NonFiniteValueException e) {
            assertTrue(e.getMessage().contains("ECAT pixel data"));
            assertEquals(1, e.getX());
            assertEquals(2, e.getY());
            assertEquals(1, e.getZ());
            assertEquals(0, e.getFrame());
        }
    }

    @Test(expected = EmptyOrZeroImageException.class)
    public void testZeroImage() throws IOException {
        new EcatToNiftiConverter().convert(
                new ParsedEcatSource(mainHeader(), subHeaders(), VoxelTensor.allocate(W, H, D, FRAMES)), null);
    }

    @Test
    public void testCustomFieldsArePassedThrough() throws IOException {
        ConversionOptions options = new ConversionOptions()
                .customField("TracerName", "FDG")
                .customField("InjectedRadioactivity", "200");
        ConversionResult result = new EcatToNiftiConverter().convert(parsedSource(), options);
        options.customField("Late", "ignored");

        assertEquals(2, result.getCustomFields().size());
        assertEquals("FDG", result.getCustomFields().get("TracerName"));
    }

    @Test
    public void testToImagePlus() throws IOException {
        ConversionResult result = new EcatToNiftiConverter().convert(parsedSource(),
                new ConversionOptions().timeZero("ScanStart").customField("TracerName", "FDG"));
        ImagePlus imp = result.toImagePlus("converted");

        assertEquals(D, imp.getNSlices());
        assertEquals(FRAMES, imp.getNFrames());
        assertEquals("mm", imp.getCalibration().getUnit());
        assertEquals(2.0, imp.getCalibration().pixelWidth, 1e-6);
        assertEquals(3.0, imp.getCalibration().pixelDepth, 1e-6);
        assertEquals("ScanStart", imp.getProperty(ConversionResult.TIME_ZERO_PROPERTY));
        assertEquals("FDG", imp.getProperty("TracerName"));
        assertEquals(String.valueOf(result.getQuantitativeFactor()),
                imp.getProperty(ConversionResult.QUANTITATIVE_FACTOR_PROPERTY));
    }

    @Test
    public void testDefaultNiftiFile() {
        File ecat = new File("/data/sub-01_pet.v");
        assertEquals(new File("/data/sub-01_pet.nii"), EcatToNiftiConverter.defaultNiftiFile(ecat, false));
        assertEquals(new File("/data/sub-01_pet.nii.gz"), EcatToNiftiConverter.defaultNiftiFile(ecat, true));
    }

    @Test
    public void testConvertAndSaveNextToEcatFile() throws IOException {
        File ecat = folder.newFile("scan.v");
        when(reader.read(ecat)).thenReturn(parsedSource());

        new EcatToNiftiConverter(reader).convertAndSave(new RawEcatSource(ecat), null);

        File nifti = new File(folder.getRoot(), "scan.nii");
        assertTrue(nifti.isFile());
        assertEquals(352L + 4L * W * H * D * FRAMES, nifti.length());
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testConvertAndSaveNeedsOutputFile() throws IOException {
        new EcatToNiftiConverter().convertAndSave(parsedSource(), null);
    }

    @Test(expected = InvalidInputCombinationException.class)
    public void testSubHeadersMustShareGeometry() throws IOException {
        List<EcatSubHeader> subs = subHeaders();
        subs.set(1, new EcatSubHeader(64, 64, 47, 0.9, 0.9, 0.9, 2, 1, 1, 100, 10));
        new EcatToNiftiConverter().convert(new ParsedEcatSource(mainHeader(), subs, rawTensor()), null);
    }

    @Test
    public void testSubHeaderPixelSizeMismatchNamesFrame() throws IOException {
        List<EcatSubHeader> subs = subHeaders();
        subs.set(1, new EcatSubHeader(W, H, D, 0.2, 0.2, 0.4, 2, 1, 1, 100, 10));
        try {
            new EcatToNiftiConverter().convert(new ParsedEcatSource(mainHeader(), subs, rawTensor()), null);
            fail("Sub-headers with different pixel sizes must be rejected.");
        } catch (InvalidInputCombinationException e) {
            assertTrue(e.getMessage().contains("frame 1"));
        }
    }

    private static String logOf(ConversionOptions options) throws IOException {
        PrintStream stdout = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true));
        try {
            new EcatToNiftiConverter().convert(parsedSource(), options);
        } finally {
            System.setOut(stdout);
        }
        return captured.toString();
    }

    @Test
    public void testMissingTimeZeroIsLogged() throws IOException {
        assertTrue(logOf(null).contains(EcatToNiftiConverter.TIME_ZERO_ADVISORY));
        assertTrue(logOf(new ConversionOptions().timeZero("")).contains(EcatToNiftiConverter.TIME_ZERO_ADVISORY));
    }

    @Test
    public void testPresentTimeZeroIsNotLogged() throws IOException {
        assertFalse(logOf(new ConversionOptions().timeZero("ScanStart"))
                .contains(EcatToNiftiConverter.TIME_ZERO_ADVISORY));
    }
}
