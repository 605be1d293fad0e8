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

/**
 * For reporting errors encountered when converting an ECAT series to NIfTI.
 * All conversion failures are deterministic properties of the input, so none of them are retried.
 * @see ShapeMismatchException
 * @see EmptyOrZeroImageException
 * @see NonFiniteValueException
 * @see InvalidInputCombinationException
 */
public class EcatConversionException extends RuntimeException {

    public EcatConversionException(String message) {
        super(message);
    }

    public EcatConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Report the message via ImageJ's `log` and `error` methods.
     * Also clear the ImageJ status bar.
     * @see IJ#log(String)
     * @see IJ#error(String, String)
     */
    public void report() {
        IJ.log("ECAT conversion error: " + getMessage());
        IJ.error("ECAT conversion error", getMessage());
        IJ.showStatus("");
    }
}
