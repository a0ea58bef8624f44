package com.evidencevault.classification;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static citation table returned with every stored verdict for downstream
 * reporting. The lists are data; nothing here is computed from content.
 */
public final class LegalReferences {

    private static final Map<ViolationCategory, List<String>> REFERENCES = new EnumMap<>(ViolationCategory.class);

    static {
        REFERENCES.put(ViolationCategory.CHILD_EXPLOITATION, List.of(
                "18 U.S.C. § 2251 (Sexual exploitation of children)",
                "18 U.S.C. § 2422(b) (Coercion and enticement of a minor)",
                "18 U.S.C. § 2258A (Reporting requirements of providers)",
                "EU Directive 2011/93/EU (Combating sexual abuse of children)",
                "UK Sexual Offences Act 2003, s.15A"));
        REFERENCES.put(ViolationCategory.VIOLENCE_THREATS, List.of(
                "18 U.S.C. § 875(c) (Interstate communication of threats)",
                "UK Malicious Communications Act 1988, s.1",
                "UK Protection from Harassment Act 1997, s.4"));
        REFERENCES.put(ViolationCategory.HARASSMENT_HATE, List.of(
                "47 U.S.C. § 223 (Obscene or harassing communications)",
                "UK Protection from Harassment Act 1997, s.2",
                "EU Framework Decision 2008/913/JHA (Racism and xenophobia)"));
        REFERENCES.put(ViolationCategory.BLACKMAIL_EXTORTION, List.of(
                "18 U.S.C. § 873 (Blackmail)",
                "18 U.S.C. § 875(d) (Extortionate threats)",
                "UK Theft Act 1968, s.21 (Blackmail)"));
        REFERENCES.put(ViolationCategory.FRAUD_FINANCIAL_CRIME, List.of(
                "18 U.S.C. § 1343 (Wire fraud)",
                "18 U.S.C. § 1956 (Laundering of monetary instruments)",
                "UK Fraud Act 2006, s.2"));
        REFERENCES.put(ViolationCategory.IP_THEFT, List.of(
                "17 U.S.C. § 506 (Criminal copyright infringement)",
                "17 U.S.C. § 512 (DMCA safe harbor notices)",
                "EU Directive 2001/29/EC (Copyright in the information society)"));
        REFERENCES.put(ViolationCategory.REFUND_ABUSE, List.of(
                "18 U.S.C. § 1343 (Wire fraud)",
                "UK Fraud Act 2006, s.3 (Failing to disclose information)"));
        REFERENCES.put(ViolationCategory.SEXUAL_SERVICES_PRICING, List.of(
                "18 U.S.C. § 2421A (Promotion or facilitation of prostitution)",
                "47 U.S.C. § 230(e)(5) (FOSTA-SESTA)",
                "UK Sexual Offences Act 2003, s.52"));
        REFERENCES.put(ViolationCategory.NSFW_FUNNELING, List.of(
                "EU Regulation 2022/2065 (Digital Services Act), Art. 16",
                "UK Online Safety Act 2023, s.10"));
        REFERENCES.put(ViolationCategory.CONSENT_WITHDRAWAL_IGNORED, List.of(
                "18 U.S.C. § 2261A (Stalking)",
                "UK Protection from Harassment Act 1997, s.2A (Stalking)"));
    }

    private LegalReferences() {
    }

    public static List<String> forCategory(ViolationCategory category) {
        return REFERENCES.getOrDefault(category, List.of());
    }
}
