package com.deepansh.memory.decision;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Content that must never be persisted, whatever the collaborator decides.
 */
public final class SecretContentGuard {

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("a password", Pattern.compile(
                "(?i)\\b(password|passwd|pwd|passcode|pin code)\\b\\s*(is|was|:|=)\\s*\\S+"));
        PATTERNS.put("a social security number", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"));
        PATTERNS.put("an API key", Pattern.compile(
                "\\b(sk|pk|rk)[-_][A-Za-z0-9_-]{16,}\\b|\\bAKIA[0-9A-Z]{16}\\b|\\bgh[pousr]_[A-Za-z0-9]{20,}\\b"
                        + "|(?i)\\b(api[_ -]?key|secret[_ -]?key|access[_ -]?token)\\b\\s*(is|:|=)\\s*\\S+"));
    }

    private static final Pattern CARD_CANDIDATE = Pattern.compile("\\b(?:\\d[ -]?){12,18}\\d\\b");

    private SecretContentGuard() {}

    /** What kind of secret the text contains, if any. */
    public static Optional<String> detect(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (Map.Entry<String, Pattern> entry : PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return Optional.of(entry.getKey());
            }
        }
        Matcher card = CARD_CANDIDATE.matcher(text);
        while (card.find()) {
            if (passesLuhn(card.group().replaceAll("[ -]", ""))) {
                return Optional.of("a card number");
            }
        }
        return Optional.empty();
    }

    static boolean passesLuhn(String digits) {
        if (digits.length() < 13 || digits.length() > 19) return false;
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) d -= 9;
            }
            sum += d;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }
}
