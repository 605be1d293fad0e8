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
 * The scanner and study level values of an ECAT main header which the conversion depends on.
 * Instances are immutable once parsed.
 */
public class EcatMainHeader {
    // Prompt and random count rates are only recorded in the sub-headers from this software version onwards.
    public static final int COUNT_RATES_MIN_VERSION = 73;

    public final int numFrames;
    public final int softwareVersion;
    // Physical units per scanner count.
    public final double calibrationFactor;

    public EcatMainHeader(int numFrames, int softwareVersion, double calibrationFactor) {
        this.numFrames = numFrames;
        this.softwareVersion = softwareVersion;
        this.calibrationFactor = calibrationFactor;
    }

    /**
     * @return true when the sub-headers of this file carry prompt and random count rates.
     */
    public boolean hasCountRates() {
        return softwareVersion >= COUNT_RATES_MIN_VERSION;
    }

    public String toString() {
        return "EcatMainHeader(numFrames=" + numFrames
                + ", softwareVersion=" + softwareVersion
                + ", calibrationFactor=" + calibrationFactor
                + ")";
    }
}
