package com.coach.linkage.importer;

import java.util.regex.Pattern;

/**
 * Format checks for contact fields read from spreadsheets.
 */
public final class ContactValidator {

    private static final Pattern EMAIL = Pattern.compile(
            "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                    + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private ContactValidator() {
    }

    public static boolean isValidEmail(String email) {
        return email != null && !email.isBlank() && EMAIL.matcher(email.trim()).matches();
    }

    /**
     * US numbers: ten digits, or eleven with a leading country code 1. Separators are ignored.
     */
    public static boolean isValidPhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return false;
        }
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        return digits.length() == 10 || (digits.length() == 11 && digits.startsWith("1"));
    }
}
