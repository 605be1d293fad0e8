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
import java.io.IOException;

/**
 * Decodes the on-disk ECAT layout into the structures the converter works on.
 * The binary parser itself lives outside this package; the converter only depends on this contract.
 */
public interface EcatReader {

    /**
     * @param file  An ECAT 7 file.
     * @return      The main header, one sub-header per frame, and the raw voxel tensor.
     * @throws IOException  When the file cannot be read or decoded.
     */
    ParsedEcatSource read(File file) throws IOException;
}
