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
 * The per-frame values of an ECAT image sub-header. The index of a sub-header in its series is the frame index.
 * All sub-headers of a valid series share the same dimensions and pixel sizes.
 * Pixel sizes are in centimeters, frame times in the units ECAT stores them.
 */
public class EcatSubHeader {
    public final int xDim;
    public final int yDim;
    public final int zDim;
    public final double xPixelSize;
    public final double yPixelSize;
    public final double zPixelSize;
    public final double scaleFactor;
    public final double frameStartTime;
    public final double frameDuration;
    // Zero when the main header's software version predates count rates.
    public final double promptRate;
    public final double randomRate;

    public EcatSubHeader(int xDim, int yDim, int zDim,
                         double xPixelSize, double yPixelSize, double zPixelSize,
                         double scaleFactor, double frameStartTime, double frameDuration,
                         double promptRate, double randomRate) {
        this.xDim = xDim;
        this.yDim = yDim;
        this.zDim = zDim;
        this.xPixelSize = xPixelSize;
        this.yPixelSize = yPixelSize;
        this.zPixelSize = zPixelSize;
        this.scaleFactor = scaleFactor;
        this.frameStartTime = frameStartTime;
        this.frameDuration = frameDuration;
        this.promptRate = promptRate;
        this.randomRate = randomRate;
    }

    /**
     * A sub-header without count rates, as written by software versions before 73.
     */
    public EcatSubHeader(int xDim, int yDim, int zDim,
                         double xPixelSize, double yPixelSize, double zPixelSize,
                         double scaleFactor, double frameStartTime, double frameDuration) {
        this(xDim, yDim, zDim, xPixelSize, yPixelSize, zPixelSize, scaleFactor, frameStartTime, frameDuration, 0, 0);
    }

    /**
     * @return true when `other` has the same dimensions and pixel sizes.
     */
    public boolean sameGeometry(EcatSubHeader other) {
        return xDim == other.xDim && yDim == other.yDim && zDim == other.zDim
                && xPixelSize == other.xPixelSize
                && yPixelSize == other.yPixelSize
                && zPixelSize == other.zPixelSize;
    }

    public String toString() {
        return "EcatSubHeader(dims=" + xDim + "x" + yDim + "x" + zDim
                + ", pixelSize=" + xPixelSize + "x" + yPixelSize + "x" + zPixelSize
                + ", scaleFactor=" + scaleFactor
                + ", frameStartTime=" + frameStartTime
                + ", frameDuration=" + frameDuration
                + ", promptRate=" + promptRate
                + ", randomRate=" + randomRate
                + ")";
    }
}
