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
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.Arrays;

/**
 * A dense 4D (X, Y, Z, frame) array of 32-bit float voxels, stored as an ImageJ stack of
 * {@link FloatProcessor} slices in hyperstack order: Z varies fastest, then frames.
 * X runs along the processor width and Y along its height.
 * All indices taken by this class are 0-based, unlike ImageStack's.
 */
public class VoxelTensor {
    private final int width;
    private final int height;
    private final int nSlices;
    private final int nFrames;
    private final ImageStack stack;

    /**
     * Wrap a stack holding `nSlices * nFrames` images. Slices which are not 32-bit float are converted,
     * all other slices are shared with the given stack.
     * @throws IllegalArgumentException When the stack size does not match the slice and frame counts.
     */
    public VoxelTensor(ImageStack stack, int nSlices, int nFrames) {
        if (nSlices < 1 || nFrames < 1)
            throw new IllegalArgumentException("A voxel tensor needs at least one slice and one frame, got "
                    + nSlices + " slices and " + nFrames + " frames.");
        if (stack.size() != nSlices * nFrames)
            throw new IllegalArgumentException("Stack of " + stack.size() + " images cannot hold "
                    + nSlices + " slices and " + nFrames + " frames.");
        this.width = stack.getWidth();
        this.height = stack.getHeight();
        this.nSlices = nSlices;
        this.nFrames = nFrames;
        this.stack = floatStack(stack);
    }

    /**
     * Allocate a tensor of zeros.
     */
    public static VoxelTensor allocate(int width, int height, int nSlices, int nFrames) {
        ImageStack stack = new ImageStack(width, height);
        for (int i = 0; i < nSlices * nFrames; ++i)
            stack.addSlice(null, new FloatProcessor(width, height));
        return new VoxelTensor(stack, nSlices, nFrames);
    }

    /**
     * Use the stack of a single channel (hyper)stack, with its Z and T dimensions, as a tensor.
     * @throws IllegalArgumentException When the image has more than one channel.
     */
    public static VoxelTensor fromImagePlus(ImagePlus imp) {
        if (imp.getNChannels() != 1)
            throw new IllegalArgumentException("Multichannel images cannot be converted: " + imp.getTitle()
                    + " has " + imp.getNChannels() + " channels.");
        return new VoxelTensor(imp.getStack(), imp.getNSlices(), imp.getNFrames());
    }

    private static ImageStack floatStack(ImageStack stack) {
        boolean allFloat = true;
        for (int i = 1; i <= stack.size(); ++i)
            allFloat &= stack.getPixels(i) instanceof float[];
        if (allFloat) return stack;
        if (IJ.debugMode) IJ.log("Converting a stack of " + stack.size() + " images to 32-bit float.");
        ImageStack converted = new ImageStack(stack.getWidth(), stack.getHeight());
        for (int i = 1; i <= stack.size(); ++i)
            converted.addSlice(stack.getSliceLabel(i), stack.getProcessor(i).convertToFloat());
        return converted;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getNSlices() {
        return nSlices;
    }

    public int getNFrames() {
        return nFrames;
    }

    /**
     * @return The shape as (X, Y, Z, frames).
     */
    public int[] shape() {
        return new int[] {width, height, nSlices, nFrames};
    }

    public long voxelCount() {
        return (long) width * height * nSlices * nFrames;
    }

    /**
     * @return The underlying stack. Changes made through it are visible in this tensor.
     */
    public ImageStack getStack() {
        return stack;
    }

    /**
     * @return The 1-based ImageStack index of slice `z` of frame `frame`.
     */
    public int stackIndex(int z, int frame) {
        if (z < 0 || z >= nSlices || frame < 0 || frame >= nFrames)
            throw new IndexOutOfBoundsException("No slice z=" + z + ", frame=" + frame + " in a tensor of shape "
                    + Arrays.toString(shape()));
        return frame * nSlices + z + 1;
    }

    /**
     * @return A processor sharing the pixels of slice `z` of frame `frame`.
     */
    public ImageProcessor getProcessor(int z, int frame) {
        return stack.getProcessor(stackIndex(z, frame));
    }

    /**
     * @return The pixel array of slice `z` of frame `frame`, in row-major (X fastest) order.
     */
    public float[] getPixels(int z, int frame) {
        return (float[]) stack.getPixels(stackIndex(z, frame));
    }

    public void setPixels(int z, int frame, float[] pixels) {
        if (pixels.length != width * height)
            throw new IllegalArgumentException("Expected " + width * height + " pixels, got " + pixels.length + ".");
        stack.setPixels(pixels, stackIndex(z, frame));
    }

    public float get(int x, int y, int z, int frame) {
        return getPixels(z, frame)[y * width + x];
    }

    public void set(int x, int y, int z, int frame, float value) {
        getPixels(z, frame)[y * width + x] = value;
    }

    /**
     * Scan for the first NaN or infinite voxel, in storage order.
     * @return The (x, y, z, frame) location of the voxel, or null when every voxel is finite.
     */
    public int[] findNonFinite() {
        for (int t = 0; t < nFrames; ++t) {
            for (int z = 0; z < nSlices; ++z) {
                float[] pixels = getPixels(z, t);
                for (int i = 0; i < pixels.length; ++i) {
                    float v = pixels[i];
                    if (Float.isNaN(v) || Float.isInfinite(v))
                        return new int[] {i % width, i / width, z, t};
                }
            }
        }
        return null;
    }

    /**
     * @throws NonFiniteValueException  When any voxel is NaN or infinite.
     */
    public void requireFinite(String where) {
        int[] loc = findNonFinite();
        if (loc != null)
            throw new NonFiniteValueException(where, loc[0], loc[1], loc[2], loc[3], get(loc[0], loc[1], loc[2], loc[3]));
    }

    public float max() {
        float max = Float.NEGATIVE_INFINITY;
        for (int i = 1; i <= stack.size(); ++i)
            for (float v : (float[]) stack.getPixels(i))
                if (v > max) max = v;
        return max;
    }

    public float min() {
        float min = Float.POSITIVE_INFINITY;
        for (int i = 1; i <= stack.size(); ++i)
            for (float v : (float[]) stack.getPixels(i))
                if (v < min) min = v;
        return min;
    }

    /**
     * Wrap this tensor's stack in a hyperstack with one channel, Z slices and T frames.
     */
    public ImagePlus toImagePlus(String title) {
        ImagePlus imp = new ImagePlus(title, stack);
        imp.setDimensions(1, nSlices, nFrames);
        if (stack.size() > 1) imp.setOpenAsHyperStack(true);
        return imp;
    }

    public String toString() {
        return "VoxelTensor(shape=" + Arrays.toString(shape()) + ")";
    }
}
