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

import java.util.Arrays;
import java.util.List;

/**
 * Checks that the voxel tensor has the shape declared by the ECAT headers.
 */
public class ShapeReconciler {

    /**
     * @return The (X, Y, Z, frames) shape declared by the first sub-header and the main header.
     */
    public static int[] declaredShape(EcatMainHeader mainHeader, List<EcatSubHeader> subHeaders) {
        EcatSubHeader first = subHeaders.get(0);
        return new int[] {first.xDim, first.yDim, first.zDim, mainHeader.numFrames};
    }

    /**
     * Accept the tensor shape when it equals the declared shape. A tensor with a single frame whose X and Y
     * extents match the declared ones is also accepted, whatever its Z extent and the declared frame count.
     * Declared extents below 1 are never accepted.
     * @param declared  The (X, Y, Z, frames) shape from the headers.
     * @param actual    The (X, Y, Z, frames) shape of the tensor.
     * @return          true when the tensor was only accepted as a single frame acquisition.
     * @throws ShapeMismatchException   When neither rule accepts the shape.
     */
    public boolean reconcile(int[] declared, int[] actual) {
        for (int extent : declared)
            if (extent < 1) throw new ShapeMismatchException(declared, actual);
        boolean singleFrame = actual[3] == 1 && actual[0] == declared[0] && actual[1] == declared[1];
        if (!Arrays.equals(declared, actual) && !singleFrame)
            throw new ShapeMismatchException(declared, actual);
        boolean exempted = singleFrame && !Arrays.equals(declared, actual);
        if (IJ.debugMode)
            IJ.log("Declared shape " + Arrays.toString(declared) + ", tensor shape " + Arrays.toString(actual)
                    + (exempted ? " (single frame)" : ""));
        return exempted;
    }
}
