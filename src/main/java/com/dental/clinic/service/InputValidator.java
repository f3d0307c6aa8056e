package com.dental.clinic.service;

import com.dental.clinic.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Form field checks applied before any store call.
 */
public final class InputValidator {

    private static final Pattern PHONE = Pattern.compile("^\\+?\\d{8,15}$");
    private static final Pattern FEE_SHAPE = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private InputValidator() {
    }

    /** Optional leading '+', then 8 to 15 ASCII digits. */
    public static Optional<String> validatePhone(String raw) {
        String phone = StringUtils.trimToEmpty(raw);
        return PHONE.matcher(phone).matches() ? Optional.of(phone) : Optional.empty();
    }

    /**
     * A finite decimal number that is zero or more. Signs, exponents and a trailing dot are
     * allowed ("+5", "1e3", "5."); Java type suffixes and hex literals are not.
     */
    public static Optional<Double> validateFee(String raw) {
        String fee = StringUtils.trimToEmpty(raw);
        if (fee.isEmpty() || !FEE_SHAPE.matcher(fee).matches()) {
            return Optional.empty();
        }
        double value;
        try {
            value = NumberUtils.createDouble(fee);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (!Double.isFinite(value) || value < 0) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public static String requirePhone(String raw) {
        return validatePhone(raw).orElseThrow(() -> new ValidationException("Invalid phone number."));
    }

    public static String requireText(String raw, String message) {
        if (StringUtils.isBlank(raw)) {
            throw new ValidationException(message);
        }
        return raw.trim();
    }

    /**
     * Blank means the fee was left out and yields {@code null}; anything else must be a valid fee.
     */
    public static Double optionalFee(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        return validateFee(raw).orElseThrow(
                () -> new ValidationException("Fee must be a non-negative number."));
    }
}
