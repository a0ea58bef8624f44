package com.evidencevault.export;

/**
 * Authority backing an export request. Which fields are mandatory depends on
 * the {@link ExportRequestType}.
 */
public record SupportingReference(String courtOrderId, String agencyId, String badgeNumber) {

    public static SupportingReference courtOrder(String courtOrderId) {
        return new SupportingReference(courtOrderId, null, null);
    }

    public static SupportingReference agency(String agencyId, String badgeNumber) {
        return new SupportingReference(null, agencyId, badgeNumber);
    }

    public static SupportingReference none() {
        return new SupportingReference(null, null, null);
    }
}
