package com.cfoPilot.aiCfo.orchestrator.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses money amounts written the way people type them: "$600,000", "50k", "$1.5M", "2 million".
 *
 * Multipliers: k/K/thousand attached to the number give x1,000; M/MM/mn/million give x1,000,000.
 * A bare lowercase "m" is never a multiplier, so "12m" stays 12.
 */
public final class AmountParser {

    /**
     * Locates an amount inside lowercased text. Case-sensitive suffix rules are applied later by
     * {@link #parse(String)} on the original-case token at the same position.
     */
    public static final String LOCATOR =
            "(?:\\$|₹|(?:usd|inr)\\s?)?\\s?(?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d+)?"
                    + "(?:k|mm|mn|m|\\s?(?:thousand|million))?(?![\\w%])";

    private static final Pattern TOKEN = Pattern.compile(
            "^(\\$|₹|USD|INR|usd|inr)?\\s*(\\d[\\d,]*(?:\\.\\d+)?)\\s*(k|K|MM|mn|M|m|(?i:thousand|million))?$");

    private AmountParser() {}

    /**
     * @param token Original-case amount text as found by {@link #LOCATOR}
     * @return parsed amount, empty when the token is not an amount
     */
    public static Optional<ParsedAmount> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        Matcher matcher = TOKEN.matcher(token.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        double value;
        try {
            value = Double.parseDouble(matcher.group(2).replace(",", ""));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        String suffix = matcher.group(3);
        value *= multiplier(suffix);

        return Optional.of(new ParsedAmount(value, currencyOf(matcher.group(1)), token.trim()));
    }

    static double multiplier(String suffix) {
        if (suffix == null) {
            return 1;
        }
        switch (suffix) {
            case "k":
            case "K":
                return 1_000;
            case "M":
            case "MM":
            case "mn":
                return 1_000_000;
            case "m":
                return 1;
            default:
                String word = suffix.toLowerCase(Locale.ROOT);
                if (word.equals("thousand")) {
                    return 1_000;
                }
                if (word.equals("million")) {
                    return 1_000_000;
                }
                return 1;
        }
    }

    private static String currencyOf(String marker) {
        if (marker == null) {
            return null;
        }
        if (marker.equals("$") || marker.equalsIgnoreCase("usd")) {
            return "USD";
        }
        return "INR";
    }

    /**
     * Query-level currency from "$", "usd" or "dollar" (USD) and "₹", "inr" or "rupee" (INR).
     *
     * @param lowerQuery Lowercased query
     */
    public static String detectCurrency(String lowerQuery) {
        if (lowerQuery.contains("$") || lowerQuery.contains("usd") || lowerQuery.contains("dollar")) {
            return "USD";
        }
        if (lowerQuery.contains("₹") || lowerQuery.contains("inr") || lowerQuery.contains("rupee")) {
            return "INR";
        }
        return null;
    }

    public record ParsedAmount(double value, String currency, String raw) {}
}
