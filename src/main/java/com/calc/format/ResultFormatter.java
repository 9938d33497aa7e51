package com.calc.format;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats calculation results for display.
 * Whole numbers print without a fractional part; other values are rounded
 * to a fixed number of significant digits and printed like C's {@code %g}:
 * plain notation unless the decimal exponent is below -4 or reaches the
 * precision, then {@code 1.5e-07} style with a two-digit exponent.
 */
public class ResultFormatter {

    public static final int DEFAULT_PRECISION = 12;

    private final MathContext context;

    public ResultFormatter() {
        this(DEFAULT_PRECISION);
    }

    public ResultFormatter(int precision) {
        if (precision <= 0) {
            throw new IllegalArgumentException("precision must be > 0");
        }
        this.context = new MathContext(precision, RoundingMode.HALF_EVEN);
    }

    public String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value)) {
            return new BigDecimal(value).toBigInteger().toString();
        }
        BigDecimal rounded = new BigDecimal(value).round(context).stripTrailingZeros();
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= context.getPrecision()) {
            return scientific(rounded, exponent);
        }
        return rounded.toPlainString();
    }

    private static String scientific(BigDecimal rounded, int exponent) {
        String digits = rounded.unscaledValue().abs().toString();
        StringBuilder sb = new StringBuilder();
        if (rounded.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude).toString();
    }
}
