package com.publicdomain.matching.matching;

import java.util.Locale;

/**
 * Library of Congress Control Number normalization.
 *
 * <ol>
 *   <li>Remove all blanks.</li>
 *   <li>Drop everything from the first forward slash.</li>
 *   <li>If a hyphen is present, remove it and left-pad the digits after it with zeros to
 *   six places, provided they are all digits and there are at most six of them.</li>
 * </ol>
 */
public final class Lccns {

    private static final int SERIAL_LENGTH = 6;

    private Lccns() {
        // Utility class
    }

    /**
     * Normalizes a raw LCCN, returning an empty string for blank input.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        int hyphen = value.indexOf('-');
        if (hyphen >= 0) {
            String prefix = value.substring(0, hyphen);
            String serial = value.substring(hyphen + 1);
            if (!serial.isEmpty() && serial.length() <= SERIAL_LENGTH && serial.chars().allMatch(Character::isDigit)) {
                value = prefix + "0".repeat(SERIAL_LENGTH - serial.length()) + serial;
            } else {
                value = prefix + serial;
            }
        }
        return value;
    }
}
