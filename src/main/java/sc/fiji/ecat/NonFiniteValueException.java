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
 * Thrown when a NaN or infinite voxel is found, which would corrupt the quantitative values downstream.
 * Locations are 0-based.
 */
public class NonFiniteValueException extends EcatConversionException {
    private final int x, y, z, frame;
    private final float value;

    public NonFiniteValueException(String where, int x, int y, int z, int frame, float value) {
        super("Non-finite value " + value + " in the " + where
                + " at x=" + x + ", y=" + y + ", z=" + z + ", frame=" + frame + ".");
        this.x = x;
        this.y = y;
        this.z = z;
        this.frame = frame;
        this.value = value;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getZ() {
        return z;
    }

    public int getFrame() {
        return frame;
    }

    public float getValue() {
        return value;
    }
}
