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
 * The input of a conversion: either an ECAT file still to be read ({@link RawEcatSource}),
 * or structures which were already read ({@link ParsedEcatSource}).
 * The alternative is resolved once, at the start of a conversion.
 */
public abstract class EcatSource {

    // Only the two alternatives in this package.
    EcatSource() {
    }

    /**
     * Turn this source into validated, parsed structures.
     * @param reader    The reader used for raw files. May be null when no raw files are converted.
     * @throws InvalidInputCombinationException When the source is incomplete or cannot be read without a reader.
     * @throws IOException  When reading the ECAT file fails.
     */
    abstract ParsedEcatSource resolve(EcatReader reader) throws IOException;

    /**
     * @return The ECAT file this source was read from, or null when unknown.
     */
    public abstract File getFile();
}
