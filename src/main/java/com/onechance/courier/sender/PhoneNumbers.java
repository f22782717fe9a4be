package com.onechance.courier.sender;

/**
 * Phone number helper.
 */
public class PhoneNumbers {

    /**
     * Private constructor to prevent instantiation.
     */
    private PhoneNumbers() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Normalizes a phone number towards E.164.
     * <p>Strips everything but digits and {@code +}.
     * <br>Numbers without a leading {@code +} get {@code +1} when 10 digits long
     * or {@code +} when 11 digits long starting with 1, other numbers are returned stripped.
     *
     * @param phoneNumber Raw input.
     * @return Normalized number.
     */
    public static String normalize(String phoneNumber) {
        if (phoneNumber == null) {
            return "";
        }

        String cleaned = phoneNumber.replaceAll("[^\\d+]", "");
        if (!cleaned.startsWith("+")) {
            if (cleaned.length() == 10) {
                cleaned = "+1" + cleaned;
            } else if (cleaned.length() == 11 && cleaned.startsWith("1")) {
                cleaned = "+" + cleaned;
            }
        }
        return cleaned;
    }
}
