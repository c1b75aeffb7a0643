package com.cfoPilot.aiCfo.orchestrator.util;

import com.cfoPilot.aiCfo.orchestrator.model.Slot;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based entity extraction. Each extractor sets its slot only on a structural match
 * (a keyword next to a number), never from a stray number elsewhere in the query.
 * Keywords are matched on the lowercased query; amounts are read from the original-case text.
 */
public final class SlotExtractor {

    private static final String A = AmountParser.LOCATOR;
    private static final String NUM = "(\\d+(?:\\.\\d+)?)";
    private static final String APPROX = "(?:about|around|approximately|roughly|~)?\\s*";
    private static final String NOT_A_DURATION =
            "(?!\\s*(?:months?|years?|weeks?|days?|customers?|employees?|people)\\b)";
    private static final String SPEND_NOUN = "(?:expenses|costs|spend|spending|opex|burn)";

    private static final List<Extractor> EXTRACTORS = List.of(
            new Extractor(SlotName.CASH, Kind.AMOUNT,
                    "\\bcash(?:\\s+balance)?\\s*(?:is|of|:|=|at|stands\\s+at|on\\s+hand(?:\\s+is)?)?\\s*" + APPROX + "(" + A + ")",
                    "(" + A + ")\\s+(?:in\\s+(?:the\\s+)?bank|(?:of\\s+|in\\s+)?cash)\\b",
                    "\\bwe\\s+have\\s+" + APPROX + "(" + A + ")" + NOT_A_DURATION),
            new Extractor(SlotName.BURN_RATE, Kind.AMOUNT,
                    "\\bburn(?:\\s+rate)?\\s*(?:is|of|:|=|at)?\\s*" + APPROX + "(" + A + ")",
                    "\\b(?:burning|spending|spend)\\s+" + APPROX + "(" + A + ")\\s*(?:/|per|a|each)\\s*(?:month|mo)\\b",
                    "(" + A + ")\\s*(?:/|per|a)\\s*(?:month|mo)\\s+(?:in\\s+)?burn\\b"),
            new Extractor(SlotName.RUNWAY_MONTHS, Kind.NUMBER,
                    NUM + "\\s*(?:-\\s*)?months?\\s+(?:of\\s+)?(?:cash\\s+)?runway",
                    "\\brunway\\s*(?:is|of|:|=|at)?\\s*" + APPROX + NUM + "\\s*months?"),
            new Extractor(SlotName.REVENUE_GROWTH, Kind.PERCENT,
                    NUM + "\\s*%\\s*(?:mom\\s+|monthly\\s+|month-over-month\\s+|annual\\s+|yoy\\s+)?(?:revenue\\s+)?growth",
                    "\\bgrow(?:s|ing|th)?\\s+(?:rate\\s+)?(?:of|at|by)?\\s*" + NUM + "\\s*%"),
            new Extractor(SlotName.BASE_REVENUE, Kind.AMOUNT,
                    "\\b(?:revenue|mrr|sales)\\s*(?:is|of|:|=|at)?\\s*" + APPROX + "(" + A + ")",
                    "(" + A + ")\\s+(?:in\\s+)?(?:monthly\\s+)?(?:revenue|mrr|sales)\\b"),
            new Extractor(SlotName.MONTHS, Kind.INTEGER,
                    "\\b(?:next|over|in|for|within|after)\\s+(?:the\\s+next\\s+)?(\\d+)\\s+months?\\b",
                    "\\b(\\d+)[- ]month\\s+(?:forecast|horizon|projection|period|plan)"),
            new Extractor(SlotName.HIRE_COUNT, Kind.INTEGER,
                    "\\b(?:hire|hiring|add|adding|recruit|recruiting|onboard|onboarding)\\s+(\\d+)\\s+(?:more\\s+|new\\s+|additional\\s+)?(?:\\w+\\s+)?"
                            + "(?:engineers?|people|employees?|developers?|staff|hires|salespeople|reps|designers?|ftes?|heads|marketers?|managers?)\\b",
                    "\\b(\\d+)\\s+(?:new|more|additional)\\s+(?:hires|engineers?|employees?|people|staff)\\b"),
            new Extractor(SlotName.ANNUAL_SALARY, Kind.AMOUNT,
                    "\\b(?:salary|salaries|comp|compensation)\\s*(?:of|at|is|:|=)?\\s*" + APPROX + "(" + A + ")",
                    "(" + A + ")\\s*(?:/|per|a)\\s*(?:year|yr|annum)\\b",
                    "(" + A + ")\\s+annually\\b",
                    "\\bat\\s+(" + A + ")\\s+(?:each|per\\s+(?:head|person|hire))"),
            new Extractor(SlotName.EXPENSES, Kind.AMOUNT,
                    "\\b(?:expenses|costs|opex|spend|spending)\\s*(?:are|is|of|:|=|at|total|totaling)?\\s*" + APPROX + "(" + A + ")"),
            new Extractor(SlotName.EXPENSE_CHANGE, Kind.NEGATIVE_PERCENT,
                    "\\b(?:cut|reduce|lower|decrease|trim|slash|drop)\\s+(?:our\\s+|my\\s+|the\\s+)?(?:monthly\\s+|operating\\s+)?" + SPEND_NOUN + "\\s+by\\s+" + NUM + "\\s*%",
                    "\\b" + SPEND_NOUN + "\\s+(?:go(?:es)?\\s+)?(?:down|decreases?|drops?|falls?)\\s+(?:by\\s+)?" + NUM + "\\s*%"),
            new Extractor(SlotName.EXPENSE_CHANGE, Kind.PERCENT,
                    "\\b(?:increase|raise|grow|boost)\\s+(?:our\\s+|my\\s+|the\\s+)?(?:monthly\\s+|operating\\s+)?" + SPEND_NOUN + "\\s+by\\s+" + NUM + "\\s*%",
                    "\\b" + SPEND_NOUN + "\\s+(?:go(?:es)?\\s+)?(?:up|increases?|rises?)\\s+(?:by\\s+)?" + NUM + "\\s*%")
    );

    private SlotExtractor() {}

    /**
     * Runs every extractor over the query. The first extractor to match a slot wins.
     *
     * @param query Original-case query
     * @return extracted slots, possibly empty
     */
    public static Map<SlotName, Slot> extract(String query) {
        Map<SlotName, Slot> slots = new EnumMap<>(SlotName.class);
        if (query == null || query.isBlank()) {
            return slots;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        String currency = AmountParser.detectCurrency(lower);

        for (Extractor extractor : EXTRACTORS) {
            if (slots.containsKey(extractor.slot())) {
                continue;
            }
            extractor.apply(query, lower, currency).ifPresent(slot -> slots.put(extractor.slot(), slot));
        }
        return slots;
    }

    private enum Kind {
        AMOUNT,
        NUMBER,
        INTEGER,
        PERCENT,
        NEGATIVE_PERCENT
    }

    private record Extractor(SlotName slot, Kind kind, List<Pattern> patterns) {

        Extractor(SlotName slot, Kind kind, String... regexes) {
            this(slot, kind, Arrays.stream(regexes).map(Pattern::compile).toList());
        }

        Optional<Slot> apply(String original, String lower, String queryCurrency) {
            for (Pattern pattern : patterns) {
                Matcher matcher = pattern.matcher(lower);
                if (matcher.find()) {
                    Optional<Slot> slot = toSlot(tokenAt(original, lower, matcher), queryCurrency);
                    if (slot.isPresent()) {
                        return slot;
                    }
                }
            }
            return Optional.empty();
        }

        private Optional<Slot> toSlot(String token, String queryCurrency) {
            switch (kind) {
                case AMOUNT:
                    return AmountParser.parse(token).map(amount -> Slot.builder()
                            .rawValue(amount.raw())
                            .normalizedValue(amount.value())
                            .currency(amount.currency() != null ? amount.currency() : queryCurrency)
                            .confidence(amount.currency() != null ? 0.9 : 0.8)
                            .build());
                case NUMBER:
                    return number(token).map(value -> slot(token, value, "months"));
                case INTEGER:
                    return number(token).map(value -> slot(token, Math.floor(value), "count"));
                case PERCENT:
                    return number(token).map(value -> slot(token + "%", value / 100.0, "fraction"));
                case NEGATIVE_PERCENT:
                    return number(token).map(value -> slot(token + "%", -value / 100.0, "fraction"));
                default:
                    return Optional.empty();
            }
        }

        private static Slot slot(String raw, double value, String unit) {
            return Slot.builder()
                    .rawValue(raw)
                    .normalizedValue(value)
                    .confidence(0.8)
                    .unit(unit)
                    .build();
        }

        private static Optional<Double> number(String token) {
            try {
                return Optional.of(Double.parseDouble(token.trim().replace(",", "")));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        /**
         * Group 1 read from the original text when lowercasing preserved offsets.
         */
        private static String tokenAt(String original, String lower, Matcher matcher) {
            if (original.length() == lower.length()) {
                return original.substring(matcher.start(1), matcher.end(1));
            }
            return matcher.group(1);
        }
    }
}
