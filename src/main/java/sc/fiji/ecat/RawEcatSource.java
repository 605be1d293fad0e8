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

import java.io.File;
import java.io.IOException;

/**
 * An ECAT file which has not been read yet.
 */
public class RawEcatSource extends EcatSource {
    private final File file;

    public RawEcatSource(File file) {
        this.file = file;
    }

    public RawEcatSource(String path) {
        this(path == null ? null : new File(path));
    }

    @Override
    ParsedEcatSource resolve(EcatReader reader) throws IOException {
        if (file == null)
            throw new InvalidInputCombinationException("Must pass in a file path for the ECAT file "
                    + "or the ECAT main header, sub-headers and pixel data.");
        if (reader == null)
            throw new InvalidInputCombinationException("No ECAT reader is available to read " + file
                    + "; pass the ECAT main header, sub-headers and pixel data instead.");
        if (!file.isFile())
            throw new InvalidInputCombinationException("Can't find ECAT file at '" + file.getPath() + "'");
        IJ.showStatus("Reading ECAT file: " + file.getName());
        ParsedEcatSource parsed = reader.read(file);
        if (parsed == null)
            throw new InvalidInputCombinationException("The ECAT reader returned nothing for " + file);
        return parsed.withFile(file).resolve(reader);
    }

    @Override
    public File getFile() {
        return file;
    }

    public String toString() {
        return "RawEcatSource(" + file + ")";
    }
}
