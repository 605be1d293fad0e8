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

/**
 * Derives the NIfTI-1 header of a converted series from the geometry of its first sub-header
 * and the outcome of the intensity rescale.
 */
public class HeaderSynthesizer {
    public static final String DESCRIPTION = "Fiji ECAT to NIfTI conversion";
    // ECAT pixel sizes are in cm, NIfTI's in mm.
    public static final double CM_TO_MM = 10;

    /**
     * @param first     The sub-header of the first frame.
     * @param shape     The (X, Y, Z, frames) shape of the converted data.
     * @param rescale   The outcome of the intensity rescale.
     * @param affine    A 3x4 or 4x4 voxel to scanner matrix to use instead of deriving one, or null.
     */
    public NiftiHeader synthesize(EcatSubHeader first, int[] shape, RescaleResult rescale, double[][] affine) {
        NiftiHeader hdr = new NiftiHeader();
        hdr.setDimensions(shape);
        hdr.intentP1 = 0;
        hdr.intentP2 = 0;
        hdr.intentP3 = 0;

        hdr.pixdim = new float[] {
                1,
                (float) (first.xPixelSize * CM_TO_MM),
                (float) (first.yPixelSize * CM_TO_MM),
                (float) (first.zPixelSize * CM_TO_MM),
                0, 0, 0, 0};
        hdr.voxOffset = NiftiHeader.SINGLE_FILE_VOX_OFFSET;
        hdr.sclInter = 0;
        hdr.sliceEnd = 0;
        hdr.sliceCode = 0;
        hdr.xyztUnits = (byte) (NiftiHeader.UNITS_MM | NiftiHeader.UNITS_UNKNOWN);

        // cal_min holds the maximum and cal_max the minimum, as existing ECAT conversions write them.
        hdr.calMin = rescale.max;
        hdr.calMax = rescale.min;

        hdr.sliceDuration = 0;
        hdr.toffset = 0;
        hdr.descrip = DESCRIPTION;
        hdr.qformCode = NiftiHeader.XFORM_UNKNOWN;
        hdr.sformCode = NiftiHeader.XFORM_SCANNER_ANAT;
        hdr.quaternB = 0;
        hdr.quaternC = 0;
        hdr.quaternD = 0;

        if (affine == null) {
            hdr.qoffsetX = (float) centeringOffset(first.xDim, first.xPixelSize);
            hdr.qoffsetY = (float) centeringOffset(first.yDim, first.yPixelSize);
            hdr.qoffsetZ = (float) centeringOffset(first.zDim, first.zPixelSize);
            hdr.srowX = new float[] {hdr.pixdim[1], 0, 0, hdr.qoffsetX};
            hdr.srowY = new float[] {0, hdr.pixdim[2], 0, hdr.qoffsetY};
            hdr.srowZ = new float[] {0, 0, hdr.pixdim[3], hdr.qoffsetZ};
        } else {
            applyAffine(hdr, affine);
        }
        if (IJ.debugMode) IJ.log("Synthesized " + hdr);
        return hdr;
    }

    /**
     * The translation which centers an axis on the scanner isocenter, with a half voxel correction:
     * -((dim * size * 10 / 2) - size * 5), in mm.
     * @param dim       The number of voxels along the axis.
     * @param pixelSize The voxel size along the axis, in cm.
     */
    public static double centeringOffset(int dim, double pixelSize) {
        return -1 * ((dim * pixelSize * CM_TO_MM / 2) - pixelSize * 5);
    }

    /**
     * @throws IllegalArgumentException When the matrix is not 3x4 or 4x4,
     *                                  or its fourth row is not (0, 0, 0, 1).
     */
    public static void checkAffine(double[][] affine) {
        if (affine.length < 3 || affine.length > 4)
            throw new IllegalArgumentException("The affine must have 3 or 4 rows, got " + affine.length + ".");
        for (double[] row : affine)
            if (row == null || row.length != 4)
                throw new IllegalArgumentException("Each affine row must have 4 columns.");
        double[] last = affine.length == 4 ? affine[3] : null;
        if (last != null && (last[0] != 0 || last[1] != 0 || last[2] != 0 || last[3] != 1))
            throw new IllegalArgumentException("The last row of the affine must be (0, 0, 0, 1), got "
                    + Arrays.toString(affine[3]) + ".");
    }

    /**
     * Copy a caller supplied matrix into the sform rows, and its translation column into the qoffsets.
     * @throws IllegalArgumentException When the matrix is not 3x4 or 4x4.
     */
    static void applyAffine(NiftiHeader hdr, double[][] affine) {
        checkAffine(affine);
        hdr.srowX = toFloats(affine[0]);
        hdr.srowY = toFloats(affine[1]);
        hdr.srowZ = toFloats(affine[2]);
        hdr.qoffsetX = hdr.srowX[3];
        hdr.qoffsetY = hdr.srowY[3];
        hdr.qoffsetZ = hdr.srowZ[3];
    }

    private static float[] toFloats(double[] row) {
        float[] r = new float[row.length];
        for (int i = 0; i < row.length; ++i)
            r[i] = (float) row[i];
        return r;
    }
}
