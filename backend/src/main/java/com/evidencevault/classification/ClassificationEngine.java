package com.evidencevault.classification;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.evidencevault.config.VaultProperties;

/**
 * Deterministic rule and keyword classifier deciding whether a piece of content
 * is evidence, private, or needs a human.
 *
 * <p>Evaluation order is fixed:
 * <ol>
 *   <li>privacy check: consensual romantic or sexual content without
 *       monetization is protected and never reaches a detector;</li>
 *   <li>violation detectors in {@link ViolationCategory} order, first hit wins;</li>
 *   <li>severity and legal references from static tables.</li>
 * </ol>
 * A hit whose confidence is below the review threshold becomes
 * {@link Decision#REQUIRES_REVIEW}.
 *
 * <p>Pure: no I/O, no state, safe to call speculatively. Content is never logged.
 */
@Component
public class ClassificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationEngine.class);

    private static final Pattern LETHAL = Pattern.compile(
            "\\b(kill|killed|murder|shoot|shot|stab|strangle|dead|die|gun|knife|bullet)\\b");

    private static final List<Pattern> EXPLICIT = PrivacySignals.patterns(
            "\\b(nudes?|naked|porn|xxx|sexting|sext|explicit|send pics|dick pic|blowjob|orgasm)\\b");

    private static final List<Pattern> OFF_PLATFORM = PrivacySignals.patterns(
            "\\b(snap|snapchat|telegram|whatsapp|kik|wickr|signal app)\\b",
            "\\b(onlyfans|fansly|manyvids|link in (my )?bio)\\b",
            "\\b(add me on|dm me on|text me at|message me on)\\b");

    private final double reviewThreshold;
    private final List<ViolationDetector> detectors;

    @Autowired
    public ClassificationEngine(VaultProperties properties) {
        this(properties.classification().reviewThreshold());
    }

    public ClassificationEngine(double reviewThreshold) {
        this.reviewThreshold = reviewThreshold;
        this.detectors = List.of(
                childExploitation(),
                ViolationDetector.ofPatterns(ViolationCategory.VIOLENCE_THREATS, 0.85,
                        "\\b(i'?ll|i will|i'?m going to|im going to|gonna|going to)\\s+(kill|murder|shoot|stab|hurt|beat|attack|rape|strangle|burn)\\b",
                        "\\b(kill|murder|shoot|stab|hurt|harm|attack)\\s+(you|u|your|them|him|her)\\b",
                        "\\b(death|die|dead)\\s+threat\\b",
                        "\\byou('?re| are)\\s+(dead|going to die|gonna die)\\b",
                        "\\bi know where you live\\b",
                        "\\bwatch your back\\b"),
                ViolationDetector.ofPatterns(ViolationCategory.HARASSMENT_HATE, 0.6,
                        "\\b(stupid|idiot|moron|loser|pathetic|worthless|useless|whore|slut)\\b",
                        "\\bhate\\s+you\\b",
                        "\\byou('?re| are)\\s+(ugly|fat|disgusting)\\b",
                        "\\b(kill yourself|kys)\\b",
                        "\\b(racist|nazi|racial slur|subhuman|go back to your country)\\b",
                        "\\b(women|men|gays?|immigrants?|foreigners|jews|muslims|christians)\\s+are\\s+(inferior|trash|garbage|animals|vermin|stupid|pigs|weak)\\b"),
                ViolationDetector.ofPatterns(ViolationCategory.BLACKMAIL_EXTORTION, 0.85,
                        "\\b(pay me|send money|send me money|give me money) or\\b",
                        "\\bi'?ll (leak|share|post|expose|send) (your|the|those|these|them)\\b",
                        "\\bunless you (pay|send|give)\\b",
                        "\\bor (i'?ll|i will) (leak|expose|share|post|tell|send)\\b",
                        "\\b(everyone|your (family|friends|boss|employer|wife|husband)) will (see|know|find out)\\b",
                        "\\b(send bitcoin|wire me)\\b"),
                ViolationDetector.ofPatterns(ViolationCategory.FRAUD_FINANCIAL_CRIME, 0.75,
                        "\\b(gift ?cards?|wire transfer|western union|moneygram)\\b",
                        "\\b(crypto(currency)? investment|investment opportunity|guaranteed (returns?|profits?)|double your money)\\b",
                        "\\b(bank (details|login)|account number|routing number|social security number|ssn)\\b",
                        "\\b(verification code|one[- ]time code|otp)\\b",
                        "\\bsend me your (card|password|pin)\\b"),
                ViolationDetector.ofPatterns(ViolationCategory.IP_THEFT, 0.7,
                        "\\b(leaked|pirated|ripped|stolen)\\s+(content|videos?|photos?|pics|onlyfans|files)\\b",
                        "\\b(re-?upload(ed|ing)?|repost(ed|ing)?) (your|her|his|their) (content|videos?|photos?)\\b",
                        "\\bsell(ing)? (your|her|his|their) (content|pics|photos|videos)\\b",
                        "\\bmega\\.nz\\b"),
                ViolationDetector.ofPatterns(ViolationCategory.REFUND_ABUSE, 0.7,
                        "\\b(chargeback|charge back)\\b",
                        "\\bdispute the (charge|payment)\\b",
                        "\\b(fake refund|refund and keep|claim (it|they) never arrived)\\b",
                        "\\brefund or\\b"),
                ViolationDetector.ofPatterns(ViolationCategory.SEXUAL_SERVICES_PRICING, 0.8,
                        "\\b(incall|outcall|in-call|out-call)\\b",
                        "\\$\\s?\\d+\\s*(/|per)\\s*(hr|hour|night|session)\\b",
                        "\\b(full service|gfe|happy ending|hourly rate)\\b",
                        "\\b(pay|paid)\\b.*\\b(sex|hookup|night together)\\b"),
                nsfwFunneling(),
                consentWithdrawalIgnored(),
                minorInRomanticContext());
    }

    public ClassificationResult classify(String content, ClassificationContext context) {
        String normalized = normalize(content);
        PrivacySignals signals = PrivacySignals.detect(normalized, context);

        if (signals.protectsPrivacy()) {
            logger.debug("Message {} protected as private content", context.messageId());
            return ClassificationResult.protectPrivacy();
        }

        for (ViolationDetector detector : detectors) {
            Optional<ViolationDetector.Hit> hit = detector.evaluate(normalized, context, signals);
            if (hit.isPresent()) {
                return verdictFor(hit.get(), normalized, context);
            }
        }
        return ClassificationResult.noViolation();
    }

    private ClassificationResult verdictFor(ViolationDetector.Hit hit, String normalized, ClassificationContext context) {
        ViolationCategory category = hit.category();
        Severity severity = severityOf(category, normalized);
        Decision decision = hit.reviewOnly() || hit.confidence() < reviewThreshold
                ? Decision.REQUIRES_REVIEW
                : Decision.STORE_EVIDENCE;

        logger.info("Message {} classified {} as {} ({}), confidence {}",
                context.messageId(), decision, category, severity, String.format(Locale.ROOT, "%.2f", hit.confidence()));

        return new ClassificationResult(decision, category, severity,
                LegalReferences.forCategory(category), hit.confidence());
    }

    static Severity severityOf(ViolationCategory category, String normalized) {
        if (category == ViolationCategory.VIOLENCE_THREATS && LETHAL.matcher(normalized).find()) {
            return Severity.CRITICAL;
        }
        return category.baseSeverity();
    }

    static String normalize(String content) {
        if (content == null) {
            return "";
        }
        return content
                .replace('\u2019', '\'')
                .replace('\u2018', '\'')
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static ViolationDetector childExploitation() {
        return new ViolationDetector() {
            @Override
            public ViolationCategory category() {
                return ViolationCategory.CHILD_EXPLOITATION;
            }

            @Override
            public int indicators(String normalized, ClassificationContext context, PrivacySignals signals) {
                int sexual = signals.sexualHits() + PrivacySignals.count(EXPLICIT, normalized);
                return signals.minorIndicated() && sexual > 0 ? signals.minorHits() + sexual : 0;
            }

            @Override
            public double baseConfidence() {
                return 0.9;
            }
        };
    }

    // a minor with affectionate but not sexual wording goes to a human, never straight to the vault
    private static ViolationDetector minorInRomanticContext() {
        return new ViolationDetector() {
            @Override
            public ViolationCategory category() {
                return ViolationCategory.CHILD_EXPLOITATION;
            }

            @Override
            public int indicators(String normalized, ClassificationContext context, PrivacySignals signals) {
                return signals.minorIndicated() && signals.romanticOrSexual() ? 1 : 0;
            }

            @Override
            public double baseConfidence() {
                return 0.5;
            }

            @Override
            public boolean reviewOnly() {
                return true;
            }
        };
    }

    private static ViolationDetector nsfwFunneling() {
        return new ViolationDetector() {
            @Override
            public ViolationCategory category() {
                return ViolationCategory.NSFW_FUNNELING;
            }

            @Override
            public int indicators(String normalized, ClassificationContext context, PrivacySignals signals) {
                int funnel = PrivacySignals.count(OFF_PLATFORM, normalized);
                if (funnel == 0) {
                    return 0;
                }
                boolean adult = signals.romanticOrSexual() || signals.monetization()
                        || PrivacySignals.count(EXPLICIT, normalized) > 0;
                return adult ? funnel + 1 : 0;
            }

            @Override
            public double baseConfidence() {
                return 0.75;
            }
        };
    }

    private static ViolationDetector consentWithdrawalIgnored() {
        return new ViolationDetector() {
            @Override
            public ViolationCategory category() {
                return ViolationCategory.CONSENT_WITHDRAWAL_IGNORED;
            }

            @Override
            public int indicators(String normalized, ClassificationContext context, PrivacySignals signals) {
                return context.consentWithdrawn() && !normalized.isEmpty() ? 1 : 0;
            }

            @Override
            public double baseConfidence() {
                return 0.9;
            }
        };
    }
}
