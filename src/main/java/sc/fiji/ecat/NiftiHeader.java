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
 * The fields of a single-file NIfTI-1 header, in the order of the on-disk layout.
 * Created once per conversion by {@link HeaderSynthesizer} and written by {@link NiftiWriter}.
 * @see <a href="https://nifti.nimh.nih.gov/pub/dist/src/niftilib/nifti1.h">nifti1.h</a>
 */
public class NiftiHeader {
    public static final int HEADER_SIZE = 348;
    // Header plus the 4 byte extension flag.
    public static final float SINGLE_FILE_VOX_OFFSET = 352;
    public static final String MAGIC_SINGLE_FILE = "n+1";

    // `datatype` codes.
    public static final short DT_FLOAT32 = 16;

    // `xyzt_units` codes.
    public static final int UNITS_UNKNOWN = 0;
    public static final int UNITS_MM = 2;
    public static final int UNITS_SEC = 8;

    // `qform_code` and `sform_code` values.
    public static final short XFORM_UNKNOWN = 0;
    public static final short XFORM_SCANNER_ANAT = 1;

    public int sizeofHdr = HEADER_SIZE;
    public byte dimInfo = 0;
    public short[] dim = new short[8];
    public float intentP1 = 0;
    public float intentP2 = 0;
    public float intentP3 = 0;
    public short intentCode = 0;
    public short datatype = DT_FLOAT32;
    public short bitpix = 32;
    public short sliceStart = 0;
    // pixdim[0] is qfac.
    public float[] pixdim = new float[8];
    public float voxOffset = SINGLE_FILE_VOX_OFFSET;
    // 0 means the stored values are used as they are.
    public float sclSlope = 0;
    public float sclInter = 0;
    public short sliceEnd = 0;
    public byte sliceCode = 0;
    public byte xyztUnits = (byte) (UNITS_MM | UNITS_UNKNOWN);
    public float calMax = 0;
    public float calMin = 0;
    public float sliceDuration = 0;
    public float toffset = 0;
    public String descrip = "";
    public String auxFile = "";
    public short qformCode = XFORM_UNKNOWN;
    public short sformCode = XFORM_UNKNOWN;
    public float quaternB = 0;
    public float quaternC = 0;
    public float quaternD = 0;
    public float qoffsetX = 0;
    public float qoffsetY = 0;
    public float qoffsetZ = 0;
    public float[] srowX = new float[4];
    public float[] srowY = new float[4];
    public float[] srowZ = new float[4];
    public String intentName = "";
    public String magic = MAGIC_SINGLE_FILE;

    /**
     * Set `dim` from the (X, Y, Z, frames) shape of the data.
     * @throws IllegalArgumentException When there are more than 7 extents or an extent does not fit in `dim`.
     */
    public void setDimensions(int[] shape) {
        if (shape.length > 7)
            throw new IllegalArgumentException("NIfTI-1 supports at most 7 dimensions, got " + shape.length + ".");
        for (int extent : shape)
            if (extent < 1 || extent > Short.MAX_VALUE)
                throw new IllegalArgumentException("Extent " + extent + " of shape " + Arrays.toString(shape)
                        + " is outside the NIfTI-1 range 1.." + Short.MAX_VALUE + ".");
        dim = new short[8];
        dim[0] = (short) shape.length;
        for (int i = 0; i < shape.length; ++i)
            dim[i + 1] = (short) shape[i];
        for (int i = shape.length + 1; i < 8; ++i)
            dim[i] = 1;
    }

    /**
     * @return  The (X, Y, Z, frames) shape recorded in `dim`.
     */
    public int[] shape() {
        int[] shape = new int[dim[0]];
        for (int i = 0; i < shape.length; ++i)
            shape[i] = dim[i + 1];
        return shape;
    }

    /**
     * @return  The sform as a 4x4 matrix with the last row (0, 0, 0, 1).
     */
    public double[][] affine() {
        double[][] a = new double[4][4];
        for (int j = 0; j < 4; ++j) {
            a[0][j] = srowX[j];
            a[1][j] = srowY[j];
            a[2][j] = srowZ[j];
        }
        a[3][3] = 1;
        return a;
    }

    /**
     * Map a voxel index to scanner coordinates, in mm, through the sform.
     */
    public double[] voxelToScanner(double i, double j, double k) {
        return new double[] {
                srowX[0] * i + srowX[1] * j + srowX[2] * k + srowX[3],
                srowY[0] * i + srowY[1] * j + srowY[2] * k + srowY[3],
                srowZ[0] * i + srowZ[1] * j + srowZ[2] * k + srowZ[3]
        };
    }

    public String toString() {
        return "NiftiHeader(sizeof_hdr=" + sizeofHdr
                + ", dim=" + Arrays.toString(dim)
                + ", datatype=" + datatype
                + ", bitpix=" + bitpix
                + ", pixdim=" + Arrays.toString(pixdim)
                + ", vox_offset=" + voxOffset
                + ", scl_slope=" + sclSlope
                + ", scl_inter=" + sclInter
                + ", xyzt_units=" + xyztUnits
                + ", cal_max=" + calMax
                + ", cal_min=" + calMin
                + ", descrip=" + descrip
                + ", qform_code=" + qformCode
                + ", sform_code=" + sformCode
                + ", qoffset=(" + qoffsetX + ", " + qoffsetY + ", " + qoffsetZ + ")"
                + ", srow_x=" + Arrays.toString(srowX)
                + ", srow_y=" + Arrays.toString(srowY)
                + ", srow_z=" + Arrays.toString(srowZ)
                + ", magic=" + magic
                + ")";
    }
}
