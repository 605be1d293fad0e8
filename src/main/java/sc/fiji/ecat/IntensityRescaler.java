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

/**
 * Rescales a frame-scaled tensor, in place, into the dynamic range of 16-bit signed storage and then into
 * physical units, keeping the single factor which recovers stored values from physical ones.
 *
 * Only an overflow of the lower 16-bit bound triggers the second pass; values above the upper bound are not
 * corrected.
 */
public class IntensityRescaler {
    public static final double INT16_MAX = 32767;
    public static final double INT16_MIN = -32768;

    /**
     * @param tensor            The tensor to rescale. It is overwritten with physical values.
     * @param calibrationFactor Physical units per count.
     * @return                  The scale, the calibration factor and the range of the rescaled tensor.
     * @throws NonFiniteValueException      When the tensor holds a NaN or infinite value,
     *                                      or one of the passes overflows the float range.
     * @throws EmptyOrZeroImageException    When the tensor's maximum is zero.
     */
    public RescaleResult rescale(VoxelTensor tensor, double calibrationFactor) {
        tensor.requireFinite("scaled image");

        float maxVal = tensor.max();
        double divisor = maxVal * INT16_MAX;
        if (divisor == 0) throw new EmptyOrZeroImageException(maxVal);
        divide(tensor, divisor);
        tensor.requireFinite("normalized image");
        double scale = maxVal / INT16_MAX;

        float minVal = tensor.min();
        boolean secondPass = false;
        if (minVal < INT16_MIN) {
            divide(tensor, minVal * INT16_MIN);
            tensor.requireFinite("normalized image");
            scale = scale * minVal / INT16_MIN;
            secondPass = true;
        }
        if (IJ.debugMode)
            IJ.log("Rescale: max=" + maxVal + ", scale=" + scale + ", second pass=" + secondPass
                    + ", calibration factor=" + calibrationFactor);

        float[] range = multiply(tensor, scale * calibrationFactor);
        tensor.requireFinite("rescaled image");
        return new RescaleResult(scale, calibrationFactor, secondPass, range[0], range[1]);
    }

    private static void divide(VoxelTensor tensor, double divisor) {
        for (int i = 1; i <= tensor.getStack().size(); ++i) {
            float[] pixels = (float[]) tensor.getStack().getPixels(i);
            for (int j = 0; j < pixels.length; ++j)
                pixels[j] = (float) (pixels[j] / divisor);
        }
    }

    /**
     * Multiply every voxel by `factor`.
     * @return  The minimum and maximum of the result.
     */
    private static float[] multiply(VoxelTensor tensor, double factor) {
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (int i = 1; i <= tensor.getStack().size(); ++i) {
            float[] pixels = (float[]) tensor.getStack().getPixels(i);
            for (int j = 0; j < pixels.length; ++j) {
                float v = (float) (pixels[j] * factor);
                pixels[j] = v;
                if (v < min) min = v;
                if (v > max) max = v;
            }
        }
        return new float[] {min, max};
    }
}
