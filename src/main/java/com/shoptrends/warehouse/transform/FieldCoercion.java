package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.exception.ValidationException;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Parsing and range checks for the raw text fields of a flat record.
 * Every failure is a {@link ValidationException} tagged with the record's natural key.
 */
final class FieldCoercion {

    static final String YES = "Yes";
    static final String NO = "No";

    /** Digits of {@link Integer#MAX_VALUE}. */
    private static final int INT_DIGITS = 10;

    private FieldCoercion() {
    }

    /**
     * Trimmed value, or {@code null} when blank.
     */
    static String text(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String requiredText(String raw, String field, int maxLength, String naturalKey) {
        String value = text(raw);
        if (value == null) {
            throw new ValidationException(naturalKey, field + " is required");
        }
        return checkLength(value, field, maxLength, naturalKey);
    }

    static String optionalText(String raw, String field, int maxLength, String naturalKey) {
        String value = text(raw);
        return value == null ? null : checkLength(value, field, maxLength, naturalKey);
    }

    /**
     * Parses an integer, accepting integral decimals such as {@code 12.0}.
     */
    static int requiredInteger(String raw, String field, String naturalKey) {
        String value = text(raw);
        if (value == null) {
            throw new ValidationException(naturalKey, field + " is required");
        }
        BigDecimal parsed = parse(value, field, naturalKey);
        if (parsed.scale() > 0 || integerDigits(parsed) > INT_DIGITS) {
            throw new ValidationException(naturalKey, field + " is not an integer: '" + value + "'");
        }
        try {
            return parsed.intValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException(naturalKey, field + " is not an integer: '" + value + "'");
        }
    }

    static Integer optionalNonNegativeInteger(String raw, String field, String naturalKey) {
        return text(raw) == null ? null : nonNegativeInteger(raw, field, naturalKey);
    }

    static int nonNegativeInteger(String raw, String field, String naturalKey) {
        int value = requiredInteger(raw, field, naturalKey);
        if (value < 0) {
            throw new ValidationException(naturalKey, field + " must not be negative: " + value);
        }
        return value;
    }

    /**
     * Parses a decimal with at most two fractional digits and at most
     * {@code integerDigits} digits before the point, returned at scale 2.
     * The magnitude is checked before rescaling, so exponents such as
     * {@code 1E+2147483647} are rejected without being expanded.
     */
    static BigDecimal requiredDecimal2(String raw, String field, int integerDigits, String naturalKey) {
        String value = text(raw);
        if (value == null) {
            throw new ValidationException(naturalKey, field + " is required");
        }
        BigDecimal parsed = parse(value, field, naturalKey);
        if (parsed.scale() > 2) {
            throw new ValidationException(naturalKey, field + " has more than two decimal places: " + value);
        }
        if (integerDigits(parsed) > integerDigits) {
            throw new ValidationException(naturalKey,
                field + " does not fit DECIMAL(" + (integerDigits + 2) + ",2): " + value);
        }
        return parsed.setScale(2);
    }

    /**
     * Normalizes yes/no style flags to {@code Yes} or {@code No}.
     */
    static String yesNo(String raw, String field, String naturalKey) {
        String value = text(raw);
        if (value == null) {
            throw new ValidationException(naturalKey, field + " is required");
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "yes":
            case "y":
            case "true":
                return YES;
            case "no":
            case "n":
            case "false":
                return NO;
            default:
                throw new ValidationException(naturalKey, field + " must be Yes or No: '" + value + "'");
        }
    }

    /**
     * Parsed value with trailing zeros stripped, so that its scale is the
     * number of significant fractional digits.
     */
    private static BigDecimal parse(String value, String field, String naturalKey) {
        try {
            return new BigDecimal(value).stripTrailingZeros();
        } catch (NumberFormatException e) {
            throw new ValidationException(naturalKey, field + " is not a number: '" + value + "'");
        } catch (ArithmeticException e) {
            // stripping zeros pushed the exponent past the int range
            throw new ValidationException(naturalKey, field + " is out of range: '" + value + "'");
        }
    }

    // long arithmetic: precision - scale overflows int for extreme exponents
    private static long integerDigits(BigDecimal value) {
        return (long) value.precision() - value.scale();
    }

    private static String checkLength(String value, String field, int maxLength, String naturalKey) {
        if (value.length() > maxLength) {
            throw new ValidationException(naturalKey,
                field + " is longer than " + maxLength + " characters: '" + value + "'");
        }
        return value;
    }
}
