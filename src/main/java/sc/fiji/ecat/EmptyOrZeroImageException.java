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
 * Thrown when the intensity rescale would divide by zero, i.e. the largest voxel of the assembled tensor is 0.
 */
public class EmptyOrZeroImageException extends EcatConversionException {
    private final double maximum;

    public EmptyOrZeroImageException(double maximum) {
        super("Cannot rescale the image: its maximum value is " + maximum
                + ", so the rescale divisor is zero. Is the image empty?");
        this.maximum = maximum;
    }

    public double getMaximum() {
        return maximum;
    }
}
