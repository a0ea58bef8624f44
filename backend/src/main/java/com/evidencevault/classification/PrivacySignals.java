package com.evidencevault.classification;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Signals evaluated before any violation detector runs. They decide whether
 * content is consensual private exchange that must be left alone.
 */
public record PrivacySignals(
        int monetizationHits,
        int coercionHits,
        int minorHits,
        int romanticHits,
        int sexualHits,
        boolean consentWithdrawn
) {

    static final List<Pattern> MONETIZATION = patterns(
            "\\$\\s?\\d+",
            "\\b\\d+\\s?(usd|eur|gbp|dollars|euros|bucks|tokens)\\b",
            "\\b(pay|paid|payment|price|prices|rate|rates|per hour|hourly|tip me|tribute|donation|fee)\\b",
            "\\b(cashapp|cash app|venmo|paypal|zelle|revolut)\\b");

    static final List<Pattern> COERCION = patterns(
            "\\bor else\\b",
            "\\bif you don'?t\\b",
            "\\bunless you\\b",
            "\\bi'?ll (leak|share|post|expose|tell|send)\\b",
            "\\b(do|send) (it|this|them|me [a-z]+) or\\b",
            "\\byou (have|need) to send\\b",
            "\\byou have no choice\\b");

    static final List<Pattern> MINOR = patterns(
            "\\b(i'?m|i am|im)\\s+(1[0-7]|[5-9])\\b(?!\\s*(min|mins|minute|minutes|hour|hours|hr|hrs|km|miles?|blocks?|%|k\\b|ft|feet|cm))",
            "\\b(1[0-7]|[5-9])\\s*(yo|y/o|yrs? old|years? old)\\b",
            "\\b(underage|under age|under 18|not 18 yet|minor)\\b",
            "\\b(middle school|junior high|[5-9]th grade|in grade [1-9])\\b");

    static final List<Pattern> ROMANTIC = patterns(
            "\\b(sexy|hot|cute|beautiful|gorgeous|handsome|pretty)\\b",
            "\\b(kiss|kisses|cuddle|flirt|crush|babe|baby|darling|sweetheart)\\b",
            "\\b(love|miss you|date|dinner together)\\b",
            "\\b(meet up|meetup|hang out|see you tonight)\\b",
            "\\b(sex|nudes?|naked|horny|sensual|intimate|turn me on|in bed)\\b");

    /** The sexual subset of {@link #ROMANTIC}: affection alone ("cute", "love", "hang out") is not in it. */
    static final List<Pattern> SEXUAL = patterns(
            "\\b(sexy|kiss|kisses|make out|touch you|touch me|in bed|turn me on)\\b",
            "\\b(sex|sexual|nudes?|naked|horny|sensual|intimate|undress|body pics?|send pics)\\b");

    static PrivacySignals detect(String normalized, ClassificationContext context) {
        int minor = count(MINOR, normalized) + (context.involvesStatedMinor() ? 1 : 0);
        return new PrivacySignals(
                count(MONETIZATION, normalized),
                count(COERCION, normalized),
                minor,
                count(ROMANTIC, normalized),
                count(SEXUAL, normalized),
                context.consentWithdrawn());
    }

    public boolean monetization() {
        return monetizationHits > 0;
    }

    public boolean coercion() {
        return coercionHits > 0;
    }

    public boolean minorIndicated() {
        return minorHits > 0;
    }

    public boolean romanticOrSexual() {
        return romanticHits > 0;
    }

    public boolean sexual() {
        return sexualHits > 0;
    }

    /**
     * Child-safety signals, coercion and a recorded withdrawal of consent each
     * remove privacy protection; none of them describe a consensual exchange.
     */
    public boolean protectionOverridden() {
        return minorIndicated() || coercion() || consentWithdrawn;
    }

    public boolean protectsPrivacy() {
        return !protectionOverridden() && romanticOrSexual() && !monetization();
    }

    static List<Pattern> patterns(String... regexes) {
        return java.util.Arrays.stream(regexes)
                .map(Pattern::compile)
                .toList();
    }

    static int count(List<Pattern> patterns, String normalized) {
        int hits = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalized).find()) {
                hits++;
            }
        }
        return hits;
    }
}
