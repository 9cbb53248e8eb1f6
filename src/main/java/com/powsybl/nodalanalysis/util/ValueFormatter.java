/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders numbers with a bounded count of significant digits and no trailing zeros: 0.072, 1000, -0.144.
 *
 * @author PowSyBl nodal analysis developers
 */
public class ValueFormatter {

    /**
     * Magnitude below which a computed quantity is rendered as zero.
     */
    public static final double ZERO_THRESHOLD = 1E-12;

    private final MathContext mathContext;

    public ValueFormatter(int significantDigits) {
        if (significantDigits < 1) {
            throw new IllegalArgumentException("Invalid significant digits: " + significantDigits);
        }
        this.mathContext = new MathContext(significantDigits, RoundingMode.HALF_EVEN);
    }

    public int getSignificantDigits() {
        return mathContext.getPrecision();
    }

    public double round(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).round(mathContext).doubleValue();
    }

    public String format(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        BigDecimal rounded = new BigDecimal(value).round(mathContext);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    public boolean isNegligible(double value) {
        return Math.abs(value) < ZERO_THRESHOLD;
    }

    /**
     * Like {@link #format(double)} but renders floating point noise left over by the solve as "0".
     */
    public String formatComputed(double value) {
        return isNegligible(value) ? "0" : format(value);
    }
}
