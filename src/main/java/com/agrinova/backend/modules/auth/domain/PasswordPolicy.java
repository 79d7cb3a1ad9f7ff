package com.agrinova.backend.modules.auth.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Strength rules for new passwords. Existing hashes are never re-validated.
 */
public final class PasswordPolicy {

    public static final int MIN_LENGTH = 12;
    public static final int MAX_LENGTH = 128;

    private static final List<String> WEAK_FRAGMENTS = List.of(
            "password", "qwerty", "letmein", "welcome", "admin", "monkey", "123456", "abc123", "guest",
            "asdf", "zxcv", "login", "sawit"
    );

    private PasswordPolicy() {
    }

    /**
     * @return human-readable violations, empty when the password is acceptable
     */
    public static List<String> violations(String password) {
        List<String> violations = new ArrayList<>();
        if (password == null || password.length() < MIN_LENGTH) {
            violations.add("must be at least " + MIN_LENGTH + " characters long");
            return violations;
        }
        if (password.length() > MAX_LENGTH) {
            violations.add("must be at most " + MAX_LENGTH + " characters long");
            return violations;
        }

        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;
        for (char c : password.toCharArray()) {
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isWhitespace(c)) {
                special = true;
            }
        }
        if (!upper) {
            violations.add("must contain an uppercase letter");
        }
        if (!lower) {
            violations.add("must contain a lowercase letter");
        }
        if (!digit) {
            violations.add("must contain a digit");
        }
        if (!special) {
            violations.add("must contain a special character");
        }

        String normalized = password.toLowerCase(Locale.ROOT);
        if (WEAK_FRAGMENTS.stream().anyMatch(normalized::contains)) {
            violations.add("must not contain a common weak pattern");
        }
        if (hasSequentialRun(normalized)) {
            violations.add("must not contain sequential characters such as abc or 123");
        }
        if (hasRepeatedRun(password)) {
            violations.add("must not repeat a character three times in a row");
        }
        return violations;
    }

    public static boolean isAcceptable(String password) {
        return violations(password).isEmpty();
    }

    private static boolean hasSequentialRun(String value) {
        for (int i = 0; i + 2 < value.length(); i++) {
            char a = value.charAt(i);
            char b = value.charAt(i + 1);
            char c = value.charAt(i + 2);
            if (!Character.isLetterOrDigit(a)) {
                continue;
            }
            boolean ascending = b == a + 1 && c == b + 1;
            boolean descending = b == a - 1 && c == b - 1;
            if (ascending || descending) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasRepeatedRun(String value) {
        for (int i = 0; i + 2 < value.length(); i++) {
            if (value.charAt(i) == value.charAt(i + 1) && value.charAt(i + 1) == value.charAt(i + 2)) {
                return true;
            }
        }
        return false;
    }
}
