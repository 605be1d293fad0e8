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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ECAT series which has already been decoded: a main header, one sub-header per frame and the voxel tensor.
 */
public class ParsedEcatSource extends EcatSource {
    private final EcatMainHeader mainHeader;
    private final List<EcatSubHeader> subHeaders;
    private final VoxelTensor tensor;
    private final File file;

    public ParsedEcatSource(EcatMainHeader mainHeader, List<EcatSubHeader> subHeaders, VoxelTensor tensor) {
        this(mainHeader, subHeaders, tensor, null);
    }

    private ParsedEcatSource(EcatMainHeader mainHeader, List<EcatSubHeader> subHeaders, VoxelTensor tensor,
                             File file) {
        this.mainHeader = mainHeader;
        this.subHeaders = subHeaders == null ? null : Collections.unmodifiableList(new ArrayList<>(subHeaders));
        this.tensor = tensor;
        this.file = file;
    }

    /**
     * @return A copy of this source remembering the file it was read from.
     */
    ParsedEcatSource withFile(File file) {
        return new ParsedEcatSource(mainHeader, subHeaders, tensor, file);
    }

    @Override
    ParsedEcatSource resolve(EcatReader reader) {
        if (mainHeader == null || subHeaders == null || tensor == null)
            throw new InvalidInputCombinationException("Must pass in a file path for the ECAT file or "
                    + "the ECAT main header, sub-headers and pixel data, got mainHeader=" + mainHeader
                    + ", subHeaders=" + (subHeaders == null ? null : subHeaders.size() + " sub-headers")
                    + ", tensor=" + tensor + " instead.");
        if (subHeaders.isEmpty())
            throw new InvalidInputCombinationException("At least one ECAT sub-header is required.");
        if (subHeaders.contains(null))
            throw new InvalidInputCombinationException("ECAT sub-headers must not be null.");
        EcatSubHeader first = subHeaders.get(0);
        for (int t = 1; t < subHeaders.size(); ++t)
            if (!first.sameGeometry(subHeaders.get(t)))
                throw new InvalidInputCombinationException("The sub-header of frame " + t + " has a different "
                        + "geometry than the first frame: " + subHeaders.get(t) + " versus " + first + ".");
        // More tensor frames than declared frames is a shape mismatch, reported later.
        int framesNeeded = Math.min(tensor.getNFrames(), mainHeader.numFrames);
        if (subHeaders.size() < framesNeeded)
            throw new InvalidInputCombinationException("Got " + subHeaders.size() + " ECAT sub-headers for "
                    + framesNeeded + " frames of pixel data.");
        return this;
    }

    public EcatMainHeader getMainHeader() {
        return mainHeader;
    }

    public List<EcatSubHeader> getSubHeaders() {
        return subHeaders;
    }

    public VoxelTensor getTensor() {
        return tensor;
    }

    @Override
    public File getFile() {
        return file;
    }

    public String toString() {
        return "ParsedEcatSource(mainHeader=" + mainHeader
                + ", subHeaders=" + (subHeaders == null ? null : subHeaders.size())
                + ", tensor=" + tensor
                + ", file=" + file
                + ")";
    }
}
