package org.dice.logic.numbers;

import org.apache.commons.lang.StringUtils;

/**
 * Conversions between decimal, binary and hexadecimal notations of non-negative integers.
 * Binary and hexadecimal strings carry no prefix; hexadecimal output is upper case.
 */
public final class NumberSystems {

    private NumberSystems() {
    }

    public static String decimalToBinary(long decimal) {
        checkNonNegative(decimal);
        return Long.toBinaryString(decimal);
    }

    /**
     * @throws NumberFormatException if {@code binary} is not a binary number
     */
    public static long binaryToDecimal(String binary) {
        return parse(binary, 2);
    }

    public static String decimalToHex(long decimal) {
        checkNonNegative(decimal);
        return Long.toHexString(decimal).toUpperCase();
    }

    /**
     * @throws NumberFormatException if {@code hex} is not a hexadecimal number
     */
    public static long hexToDecimal(String hex) {
        return parse(hex, 16);
    }

    public static String binaryToHex(String binary) {
        return decimalToHex(binaryToDecimal(binary));
    }

    public static String hexToBinary(String hex) {
        return decimalToBinary(hexToDecimal(hex));
    }

    /**
     * Left pads with zeros to {@code bits} digits. Longer strings are returned unchanged.
     */
    public static String padBinary(String binary, int bits) {
        parse(binary, 2);
        return StringUtils.leftPad(binary.trim(), bits, '0');
    }

    public static String padBinary(String binary) {
        return padBinary(binary, 8);
    }

    private static long parse(String digits, int radix) {
        if (StringUtils.isBlank(digits)) {
            throw new NumberFormatException("Empty number");
        }
        String trimmed = digits.trim();
        if (trimmed.startsWith("-") || trimmed.startsWith("+")) {
            throw new NumberFormatException("Signed numbers are not supported: " + digits);
        }
        return Long.parseLong(trimmed, radix);
    }

    private static void checkNonNegative(long decimal) {
        if (decimal < 0) {
            throw new IllegalArgumentException("Negative numbers are not supported: " + decimal);
        }
    }
}
