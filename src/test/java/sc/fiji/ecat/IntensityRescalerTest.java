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

import org.junit.Test;

public class IntensityRescalerTest {
    private static final double INT16_MAX_SQUARED = 32767.0 * 32767.0;

    private final IntensityRescaler rescaler = new IntensityRescaler();

    private static VoxelTensor tensorOf(float... values) {
        VoxelTensor tensor = VoxelTensor.allocate(values.length, 1, 1, 1);
        System.arraycopy(values, 0, tensor.getPixels(0, 0), 0, values.length);
        return tensor;
    }

    @Test
    public void testValuesAreRescaledIntoPhysicalUnits() {
        VoxelTensor tensor = tensorOf(0, 1, 2, 4);
        RescaleResult result = rescaler.rescale(tensor, 3.0);

        assertFalse(result.secondPass);
        assertEquals(4 / 32767.0, result.scale, 1e-15);
        assertEquals(3.0, result.calibrationFactor, 0.0);
        assertEquals(result.scale * 3.0, result.quantitativeFactor(), 0.0);
        for (int x = 0; x < 4; ++x) {
            double expected = tensorOf(0, 1, 2, 4).get(x, 0, 0, 0) * 3.0 / INT16_MAX_SQUARED;
            assertEquals(expected, tensor.get(x, 0, 0, 0), Math.abs(expected) * 1e-6);
        }
        assertEquals(tensor.max(), result.max, 0f);
        assertEquals(tensor.min(), result.min, 0f);
    }

    @Test
    public void testZeroImageIsRejected() {
        try {
            rescaler.rescale(VoxelTensor.allocate(4, 4, 2, 1), 1.0);
            fail("An all-zero image must be rejected.");
        } catch (EmptyOrZeroImageException e) {
            assertEquals(0.0, e.getMaximum(), 0.0);
        }
    }

    @Test
    public void testZeroMaximumWithNegativeValuesIsRejected() {
        try {
            rescaler.rescale(tensorOf(-3, -1, 0), 1.0);
            fail("A zero maximum must be rejected.");
        } catch (EmptyOrZeroImageException e) {
            assertEquals(0.0, e.getMaximum(), 0.0);
        }
    }

    @Test
    public void testNonFiniteValueIsRejected() {
        try {
            rescaler.rescale(tensorOf(1, Float.NaN, 2), 1.0);
            fail("A NaN voxel must be rejected.");
        } catch (NonFiniteValueException e) {
            assertEquals(1, e.getX());
        }
    }

    @Test
    public void testScaleFollowsInputMagnitude() {
        RescaleResult unit = rescaler.rescale(tensorOf(-1, 1, 5, 10), 1.0);
        RescaleResult scaled = rescaler.rescale(tensorOf(-7, 7, 35, 70), 1.0);
        assertEquals(7 * unit.scale, scaled.scale, 1e-12);
        assertFalse(scaled.secondPass);
    }

    @Test
    public void testLargeNegativeValuesDoNotTriggerSecondPass() {
        RescaleResult result = rescaler.rescale(tensorOf(-40000, 0, 10000), 1.0);
        assertFalse(result.secondPass);
        assertEquals(10000 / 32767.0, result.scale, 1e-12);
        assertTrue(Math.abs(result.min) <= 32767);
        assertTrue(Math.abs(result.max) <= 32767);
    }

    @Test
    public void testIntermediateStaysWithinLowerBound() {
        VoxelTensor tensor = tensorOf(-40000, -3, 0, 2, 10000);
        RescaleResult result = rescaler.rescale(tensor, 0.8);
        for (float v : tensor.getPixels(0, 0)) {
            double intermediate = v / result.scale / result.calibrationFactor;
            assertTrue(intermediate >= -32768);
            assertTrue(intermediate <= 32767);
        }
    }

    @Test
    public void testLowerBoundOverflowTriggersSecondPass() {
        float max = 1e-9f;
        VoxelTensor tensor = tensorOf(-40000, 0, max);
        RescaleResult result = rescaler.rescale(tensor, 2.0);

        assertTrue(result.secondPass);
        double intermediateMin = -40000 / (max * 32767.0);
        double expectedScale = (max / 32767.0) * intermediateMin / -32768.0;
        assertEquals(expectedScale, result.scale, expectedScale * 1e-5);

        // Dividing by the quantitative factor gives back values within the 16-bit lower bound.
        for (int x = 0; x < 3; ++x)
            assertTrue(tensor.get(x, 0, 0, 0) / result.quantitativeFactor() >= -32768);
        assertEquals(-1 / 32768.0, result.min / result.quantitativeFactor(), 1e-9);
    }

    @Test
    public void testUpperBoundIsNotCorrected() {
        // Only the lower bound is checked, so a positive-only image never takes the second pass.
        RescaleResult result = rescaler.rescale(tensorOf(1e30f, 1), 1.0);
        assertFalse(result.secondPass);
    }

    @Test
    public void testOverflowDuringNormalizationIsRejected() {
        try {
            rescaler.rescale(tensorOf(Float.MIN_VALUE, -1f), 1.0);
            fail("A pass overflowing to infinity must be rejected.");
        } catch (NonFiniteValueException e) {
            assertTrue(Float.isInfinite(e.getValue()));
            assertEquals(1, e.getX());
            assertTrue(e.getMessage().contains("normalized image"));
        }
    }

    @Test(expected = NonFiniteValueException.class)
    public void testOverflowingCalibrationIsRejected() {
        rescaler.rescale(tensorOf(1, 32767), Double.MAX_VALUE);
    }
}
