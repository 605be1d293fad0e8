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
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.List;

/**
 * Copies each frame of the raw tensor into the output tensor, multiplied by the frame's scale factor and
 * reversed along Z, Y and X to go from ECAT's voxel ordering to NIfTI's, and collects the frame timings.
 */
public class FrameScaler {
    // Applied to frame times and to count rates.
    public static final double TIME_SCALE = 60;

    /**
     * Scale every frame of `input` into the frame with the same index of `output`.
     * A frame of `input` with one slice fills every slice of an `output` frame, otherwise the slice counts
     * must agree. Output frames beyond the input's frame count are left untouched.
     * @param mainHeader    Decides whether count rates are available.
     * @param subHeaders    One sub-header per input frame.
     * @param input         The raw tensor.
     * @param output        A tensor with the declared shape, which receives the scaled frames.
     * @return              The timings of the input frames.
     * @throws ShapeMismatchException   When an input frame cannot fill an output frame.
     */
    public FrameTimings scale(EcatMainHeader mainHeader, List<EcatSubHeader> subHeaders,
                              VoxelTensor input, VoxelTensor output) {
        FrameTimings timings = new FrameTimings();
        int nFrames = input.getNFrames();
        for (int t = 0; t < nFrames; ++t) {
            IJ.showStatus("Loading frame " + (t + 1));
            EcatSubHeader sub = subHeaders.get(t);
            if (IJ.debugMode) IJ.log("Frame " + (t + 1) + ": " + sub);

            ImageProcessor[] slab = scaledSlab(input, t, sub.scaleFactor);
            flipZ(slab);
            flipY(slab);
            flipX(slab);
            store(slab, output, t, input);

            double start = sub.frameStartTime * TIME_SCALE;
            double duration = sub.frameDuration * TIME_SCALE;
            double prompts = 0;
            double randoms = 0;
            if (mainHeader.hasCountRates()) {
                prompts = sub.promptRate * sub.frameDuration * TIME_SCALE;
                randoms = sub.randomRate * sub.frameDuration * TIME_SCALE;
            }
            timings.add(start, duration, prompts, randoms);
            IJ.showProgress(t + 1, nFrames);
        }
        IJ.showProgress(1.0);
        return timings;
    }

    /**
     * @return  New processors holding the slices of frame `t` multiplied by `scaleFactor`.
     */
    static ImageProcessor[] scaledSlab(VoxelTensor tensor, int t, double scaleFactor) {
        ImageProcessor[] slab = new ImageProcessor[tensor.getNSlices()];
        for (int z = 0; z < slab.length; ++z) {
            float[] raw = tensor.getPixels(z, t);
            float[] scaled = new float[raw.length];
            for (int i = 0; i < raw.length; ++i)
                scaled[i] = (float) (raw[i] * scaleFactor);
            slab[z] = new FloatProcessor(tensor.getWidth(), tensor.getHeight(), scaled);
        }
        return slab;
    }

    /**
     * Reverse the X axis of every slice in place.
     */
    static void flipX(ImageProcessor[] slab) {
        for (ImageProcessor ip : slab)
            ip.flipHorizontal();
    }

    /**
     * Reverse the Y axis of every slice in place.
     */
    static void flipY(ImageProcessor[] slab) {
        for (ImageProcessor ip : slab)
            ip.flipVertical();
    }

    /**
     * Reverse the order of the slices.
     */
    static void flipZ(ImageProcessor[] slab) {
        for (int i = 0, j = slab.length - 1; i < j; ++i, --j) {
            ImageProcessor tmp = slab[i];
            slab[i] = slab[j];
            slab[j] = tmp;
        }
    }

    private static void store(ImageProcessor[] slab, VoxelTensor output, int t, VoxelTensor input) {
        int nSlices = output.getNSlices();
        if (slab.length == nSlices) {
            for (int z = 0; z < nSlices; ++z)
                output.setPixels(z, t, (float[]) slab[z].getPixels());
        } else if (slab.length == 1) {
            // A lone slice is repeated through the whole frame.
            float[] pixels = (float[]) slab[0].getPixels();
            for (int z = 0; z < nSlices; ++z)
                output.setPixels(z, t, pixels.clone());
        } else {
            throw new ShapeMismatchException(output.shape(), input.shape());
        }
    }
}
