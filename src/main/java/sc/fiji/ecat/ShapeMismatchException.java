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

import java.util.Arrays;

/**
 * Thrown when the geometry declared by the ECAT headers disagrees with the shape of the voxel tensor.
 */
public class ShapeMismatchException extends EcatConversionException {
    private final int[] expected;
    private final int[] actual;

    /**
     * @param expected  The (X, Y, Z, frames) shape obtained from the headers.
     * @param actual    The (X, Y, Z, frames) shape of the voxel tensor.
     */
    public ShapeMismatchException(int[] expected, int[] actual) {
        super("Mismatch between expected X, Y, Z and number of frames " + Arrays.toString(expected)
                + " obtained from the headers and the shape of the imaging data " + Arrays.toString(actual) + ".");
        this.expected = expected.clone();
        this.actual = actual.clone();
    }

    public int[] getExpected() {
        return expected.clone();
    }

    public int[] getActual() {
        return actual.clone();
    }
}
