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

/**
 * The outcome of {@link IntensityRescaler#rescale}.
 * A rescaled voxel `v` was `v / (scale * calibrationFactor)` in the 16-bit compatible intermediate range.
 */
public class RescaleResult {
    public final double scale;
    public final double calibrationFactor;
    // Whether the lower bound correction ran.
    public final boolean secondPass;
    public final float min;
    public final float max;

    public RescaleResult(double scale, double calibrationFactor, boolean secondPass, float min, float max) {
        this.scale = scale;
        this.calibrationFactor = calibrationFactor;
        this.secondPass = secondPass;
        this.min = min;
        this.max = max;
    }

    /**
     * @return  The factor converting the 16-bit compatible intermediate values into physical units.
     */
    public double quantitativeFactor() {
        return scale * calibrationFactor;
    }

    public String toString() {
        return "RescaleResult(scale=" + scale
                + ", calibrationFactor=" + calibrationFactor
                + ", secondPass=" + secondPass
                + ", min=" + min
                + ", max=" + max
                + ")";
    }
}
