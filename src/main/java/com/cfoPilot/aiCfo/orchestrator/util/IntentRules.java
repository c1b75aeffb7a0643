package com.cfoPilot.aiCfo.orchestrator.util;

import com.cfoPilot.aiCfo.orchestrator.model.IntentRule;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ordered keyword rules for the pattern classifier, most specific first.
 * The first rule with a matching indicator wins; {@link #DEFAULT} applies when none match.
 */
public final class IntentRules {

    private static final double HIGH_BASE = 0.90;
    private static final double HIGH_MAX = 0.98;
    private static final double STANDARD_BASE = 0.80;
    private static final double STANDARD_MIN = 0.70;
    private static final double STANDARD_MAX = 0.95;

    public static final IntentRule DEFAULT = IntentRule.builder()
            .intent(IntentType.STRATEGY_RECOMMENDATION)
            .indicators(patterns(
                    "\\bstrateg(?:y|ies|ic)\\b", "\\brecommend", "\\badvi[cs]e\\b", "\\bshould\\s+(?:we|i)\\b",
                    "\\bprioriti", "\\bimprove\\b", "\\bplan\\b"))
            .base(0.55)
            .min(0.50)
            .max(0.90)
            .relevantSlots(EnumSet.noneOf(SlotName.class))
            .build();

    public static final List<IntentRule> RULES = List.of(
            standard(IntentType.MONTE_CARLO, EnumSet.noneOf(SlotName.class),
                    "monte\\s*carlo", "\\bprobabilistic\\b", "\\bp(?:10|50|90)\\b", "probability\\s+distribution",
                    "\\b\\d+\\s+(?:simulations|iterations)\\b"),
            standard(IntentType.GENERATE_BOARD_DECK, EnumSet.noneOf(SlotName.class),
                    "\\bboard\\s+(?:deck|presentation|pack|meeting\\s+slides)", "\\binvestor\\s+(?:deck|update)"),
            standard(IntentType.EXPORT_REPORT, EnumSet.noneOf(SlotName.class),
                    "\\bexport\\b", "\\bdownload\\b.*\\breport\\b", "\\b(?:pdf|csv|excel)\\s+report\\b"),
            standard(IntentType.DATA_IMPORT, EnumSet.noneOf(SlotName.class),
                    "\\bimport(?:ing)?\\b", "\\bupload(?:ing)?\\b", "\\bcsv\\b"),
            standard(IntentType.MODEL_SYNC, EnumSet.noneOf(SlotName.class),
                    "\\bsync(?:hroni[sz]e)?\\b", "\\brefresh\\s+(?:the\\s+|my\\s+|our\\s+)?model\\b",
                    "\\bre-?run\\s+(?:the\\s+|my\\s+|our\\s+)?model\\b"),
            high(IntentType.SCENARIO_SIMULATION, EnumSet.of(SlotName.REVENUE_GROWTH, SlotName.EXPENSE_CHANGE, SlotName.HIRE_COUNT),
                    "\\bwhat\\s+if\\b", "\\bscenarios?\\b", "\\bsimulat(?:e|ion)\\b", "\\bstress\\s+test",
                    "\\bupside\\b", "\\bdownside\\b"),
            standard(IntentType.ASSUMPTION_EDIT, EnumSet.of(SlotName.EXPENSE_CHANGE),
                    "\\bassumptions?\\b",
                    "\\b(?:cut|reduce|lower|decrease|trim|slash|increase|raise|boost)\\s+(?:our\\s+|my\\s+|the\\s+)?"
                            + "(?:monthly\\s+|operating\\s+)?(?:expenses|costs|spend|spending|opex|burn)\\s+by\\s+\\d"),
            high(IntentType.RUNWAY_CALCULATION, EnumSet.of(SlotName.CASH, SlotName.BURN_RATE, SlotName.RUNWAY_MONTHS),
                    "\\brunway\\b", "\\bhow\\s+long\\b.*\\b(?:cash|money|funds)\\b", "\\bcash\\s+(?:will\\s+)?last\\b",
                    "\\bmonths?\\s+of\\s+cash\\b"),
            high(IntentType.BURN_RATE_CALCULATION, EnumSet.of(SlotName.BURN_RATE, SlotName.EXPENSES, SlotName.CASH, SlotName.RUNWAY_MONTHS),
                    "\\bburn(?:ing|ed)?\\b", "\\bburn\\s+rate\\b", "\\bcash\\s+burn\\b", "\\bmonthly\\s+(?:spend|spending|outflow)\\b",
                    "\\bspending\\b"),
            standard(IntentType.CASH_SURVIVAL_ESTIMATION, EnumSet.of(SlotName.CASH, SlotName.BURN_RATE),
                    "\\bsurviv(?:e|al)\\b", "\\brun\\s+out\\s+of\\s+(?:cash|money)\\b", "\\bzero\\s+cash\\b",
                    "\\bcash[- ]?out\\s+date\\b", "\\bstay\\s+afloat\\b", "\\bdefault\\s+alive\\b"),
            high(IntentType.FUNDRAISING_READINESS, EnumSet.of(SlotName.CASH, SlotName.RUNWAY_MONTHS),
                    "\\bfundrais(?:e|ing)\\b", "\\braise\\s+(?:a\\s+|our\\s+|the\\s+|more\\s+)?(?:round|capital|funding|money|seed|series)",
                    "\\bfunding\\b", "\\binvestors?\\b", "\\bseries\\s+[a-d]\\b", "\\bvaluation\\b"),
            standard(IntentType.CHURN_IMPACT, EnumSet.noneOf(SlotName.class),
                    "\\bchurn", "\\bretention\\b", "\\bcancell?ations?\\b"),
            standard(IntentType.CAC_LTV_ANALYSIS, EnumSet.noneOf(SlotName.class),
                    "\\bcac\\b", "\\bltv\\b", "\\blifetime\\s+value\\b", "\\bacquisition\\s+cost", "\\bpayback\\b"),
            standard(IntentType.UNIT_ECONOMICS_ANALYSIS, EnumSet.noneOf(SlotName.class),
                    "\\bunit\\s+economics\\b", "\\bcontribution\\s+margin\\b", "\\bper[- ]customer\\b", "\\bkpis?\\b",
                    "\\bmetrics\\b"),
            standard(IntentType.PRICING_IMPACT, EnumSet.noneOf(SlotName.class),
                    "\\bpric(?:e|es|ing)\\b", "\\bdiscounts?\\b", "\\btiers?\\b"),
            high(IntentType.REVENUE_FORECAST, EnumSet.of(SlotName.BASE_REVENUE, SlotName.REVENUE_GROWTH, SlotName.MONTHS),
                    "\\brevenue\\b", "\\bsales\\b", "\\bmrr\\b", "\\barr\\b", "\\btop[- ]line\\b", "\\bgrowth\\b"),
            standard(IntentType.EXPENSE_FORECAST, EnumSet.of(SlotName.EXPENSES, SlotName.MONTHS),
                    "\\b(?:expenses?|costs?|spend)\\s+(?:forecast|projection)", "\\bforecast(?:ed)?\\s+(?:expenses|costs|spend)",
                    "\\bfuture\\s+(?:expenses|costs)\\b", "\\bproject(?:ed)?\\s+(?:expenses|costs)\\b"),
            standard(IntentType.HEADCOUNT_PLANNING, EnumSet.of(SlotName.HIRE_COUNT),
                    "\\bheadcount\\b", "\\bhiring\\s+plan\\b", "\\bteam\\s+size\\b", "\\borg(?:anization)?\\s+plan\\b"),
            standard(IntentType.HIRE_IMPACT, EnumSet.of(SlotName.HIRE_COUNT, SlotName.ANNUAL_SALARY),
                    "\\bhir(?:e|es|ing)\\b", "\\brecruit", "\\bnew\\s+(?:engineers?|employees?|staff)\\b"),
            high(IntentType.MARGIN_IMPROVEMENT, EnumSet.noneOf(SlotName.class),
                    "\\bmargins?\\b", "\\bprofitab(?:le|ility)\\b", "\\bgross\\s+profit\\b"),
            high(IntentType.COST_OPTIMIZATION, EnumSet.of(SlotName.EXPENSES, SlotName.EXPENSE_CHANGE),
                    "\\bcosts?\\b", "\\bexpenses\\b", "\\bsavings?\\b", "\\bsave\\s+money\\b",
                    "\\b(?:reduce|cut|optimi[sz]e)\\s+(?:our\\s+|my\\s+)?(?:expenses|spend|costs|opex)\\b"),
            standard(IntentType.VARIANCE_ANALYSIS, EnumSet.noneOf(SlotName.class),
                    "\\bvariance\\b", "\\bdeviation\\b", "\\b(?:over|under)spen[dt]\\b"),
            standard(IntentType.BUDGET_VS_ACTUAL, EnumSet.noneOf(SlotName.class),
                    "\\bbudget\\b", "\\bactuals?\\b", "\\bplan\\s+vs\\.?\\b"),
            standard(IntentType.ANOMALY_DETECTION, EnumSet.noneOf(SlotName.class),
                    "\\banomal(?:y|ies|ous)\\b", "\\bunusual\\b", "\\boutliers?\\b", "\\bspikes?\\b"),
            standard(IntentType.RISK_ANALYSIS, EnumSet.noneOf(SlotName.class),
                    "\\brisks?\\b", "\\bthreats?\\b", "\\bexposure\\b", "\\bwarning\\s+signs?\\b")
    );

    private IntentRules() {}

    private static IntentRule high(IntentType intent, Set<SlotName> slots, String... regexes) {
        return IntentRule.builder()
                .intent(intent)
                .indicators(patterns(regexes))
                .base(HIGH_BASE)
                .min(HIGH_BASE)
                .max(HIGH_MAX)
                .relevantSlots(slots)
                .build();
    }

    private static IntentRule standard(IntentType intent, Set<SlotName> slots, String... regexes) {
        return IntentRule.builder()
                .intent(intent)
                .indicators(patterns(regexes))
                .base(STANDARD_BASE)
                .min(STANDARD_MIN)
                .max(STANDARD_MAX)
                .relevantSlots(slots)
                .build();
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }
}
