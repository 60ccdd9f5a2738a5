/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Raylink.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.raylink.channel;

/**
 * Immutable complex number, used for channel frequency response coefficients.
 *
 * @param real      real part
 * @param imaginary imaginary part
 * @author hal.hildebrand
 */
public record Complex(double real, double imaginary) {

    public static final Complex ZERO = new Complex(0.0, 0.0);

    /**
     * @return |z|
     */
    public double magnitude() {
        return Math.hypot(real, imaginary);
    }

    /**
     * @return |z|^2, the power gain of a CFR coefficient
     */
    public double power() {
        return real * real + imaginary * imaginary;
    }

    /**
     * @return arg(z) in radians
     */
    public double phase() {
        return Math.atan2(imaginary, real);
    }

    @Override
    public String toString() {
        return imaginary >= 0.0 ? real + "+" + imaginary + "j" : real + "" + imaginary + "j";
    }
}
