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

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.zip.GZIPOutputStream;

/**
 * Writes a converted series as a single-file NIfTI-1 image: the 348 byte header, 4 zero extension bytes,
 * then the float32 voxels with X varying fastest, followed by Y, Z and the frames.
 */
public class NiftiWriter {
    public static final int EXTENSION_SIZE = 4;

    // Little-endian unless cleared.
    public boolean intelByteOrder = true;

    /**
     * Write the result, gzip compressed when the file name ends with .gz.
     */
    public void write(ConversionResult result, File file) throws IOException {
        write(result, file, false);
    }

    /**
     * @param result    The converted series.
     * @param file      The file to create or overwrite.
     * @param compress  Gzip the output. Also done when the file name ends with .gz.
     * @throws IOException  When writing fails.
     */
    public void write(ConversionResult result, File file, boolean compress) throws IOException {
        IJ.showStatus("Writing " + file.getName());
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(file.toPath()));
        try {
            if (compress || file.getName().endsWith(".gz"))
                out = new GZIPOutputStream(out);
            write(result.getHeader(), result.getTensor(), out);
        } finally {
            out.close();
        }
        IJ.showStatus("");
    }

    /**
     * Write the header, extension flag and voxels to an open stream. The stream is not closed.
     */
    public void write(NiftiHeader hdr, VoxelTensor tensor, OutputStream out) throws IOException {
        out.write(encodeHeader(hdr));
        out.write(new byte[EXTENSION_SIZE]);
        writeVoxels(tensor, out);
        out.flush();
    }

    /**
     * @return  The 348 header bytes.
     */
    public byte[] encodeHeader(NiftiHeader hdr) {
        ByteBuffer b = ByteBuffer.allocate(NiftiHeader.HEADER_SIZE);
        b.order(intelByteOrder ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
        b.putInt(hdr.sizeofHdr);
        putString(b, "", 10);           // data_type
        putString(b, "", 18);           // db_name
        b.putInt(0);                    // extents
        b.putShort((short) 0);          // session_error
        b.put((byte) 'r');              // regular
        b.put(hdr.dimInfo);
        for (int i = 0; i < 8; ++i) b.putShort(hdr.dim[i]);
        b.putFloat(hdr.intentP1);
        b.putFloat(hdr.intentP2);
        b.putFloat(hdr.intentP3);
        b.putShort(hdr.intentCode);
        b.putShort(hdr.datatype);
        b.putShort(hdr.bitpix);
        b.putShort(hdr.sliceStart);
        for (int i = 0; i < 8; ++i) b.putFloat(hdr.pixdim[i]);
        b.putFloat(hdr.voxOffset);
        b.putFloat(hdr.sclSlope);
        b.putFloat(hdr.sclInter);
        b.putShort(hdr.sliceEnd);
        b.put(hdr.sliceCode);
        b.put(hdr.xyztUnits);
        b.putFloat(hdr.calMax);
        b.putFloat(hdr.calMin);
        b.putFloat(hdr.sliceDuration);
        b.putFloat(hdr.toffset);
        b.putInt(0);                    // glmax
        b.putInt(0);                    // glmin
        putString(b, hdr.descrip, 80);
        putString(b, hdr.auxFile, 24);
        b.putShort(hdr.qformCode);
        b.putShort(hdr.sformCode);
        b.putFloat(hdr.quaternB);
        b.putFloat(hdr.quaternC);
        b.putFloat(hdr.quaternD);
        b.putFloat(hdr.qoffsetX);
        b.putFloat(hdr.qoffsetY);
        b.putFloat(hdr.qoffsetZ);
        for (int i = 0; i < 4; ++i) b.putFloat(hdr.srowX[i]);
        for (int i = 0; i < 4; ++i) b.putFloat(hdr.srowY[i]);
        for (int i = 0; i < 4; ++i) b.putFloat(hdr.srowZ[i]);
        putString(b, hdr.intentName, 16);
        putString(b, hdr.magic, 4);
        return b.array();
    }

    // NUL padded, truncated to leave room for the terminator.
    private static void putString(ByteBuffer b, String s, int length) {
        byte[] field = new byte[length];
        if (s != null) {
            byte[] bytes = s.getBytes(StandardCharsets.US_ASCII);
            System.arraycopy(bytes, 0, field, 0, Math.min(bytes.length, length - 1));
        }
        b.put(field);
    }

    private void writeVoxels(VoxelTensor tensor, OutputStream out) throws IOException {
        int nSlices = tensor.getNSlices();
        int nFrames = tensor.getNFrames();
        int total = nSlices * nFrames;
        byte[] buffer = new byte[4 * tensor.getWidth() * tensor.getHeight()];
        for (int t = 0; t < nFrames; ++t) {
            for (int z = 0; z < nSlices; ++z) {
                float[] pixels = tensor.getPixels(z, t);
                if (intelByteOrder) {
                    for (int i = 0, j = 0; i < pixels.length; ++i, j += 4) {
                        int value = Float.floatToRawIntBits(pixels[i]);
                        buffer[j] = (byte) value;
                        buffer[j + 1] = (byte) (value >> 8);
                        buffer[j + 2] = (byte) (value >> 16);
                        buffer[j + 3] = (byte) (value >> 24);
                    }
                } else {
                    for (int i = 0, j = 0; i < pixels.length; ++i, j += 4) {
                        int value = Float.floatToRawIntBits(pixels[i]);
                        buffer[j + 3] = (byte) value;
                        buffer[j + 2] = (byte) (value >> 8);
                        buffer[j + 1] = (byte) (value >> 16);
                        buffer[j] = (byte) (value >> 24);
                    }
                }
                out.write(buffer);
                IJ.showProgress(t * nSlices + z + 1, total);
            }
        }
    }
}
