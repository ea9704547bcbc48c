package com.ewale.ewale.util;

/**
 * Ghana MSISDN helpers. Numbers are kept in international form (233XXXXXXXXX).
 */
public final class MobileNumberUtil {

    private MobileNumberUtil() {
    }

    /**
     * Converts {@code 0XXXXXXXXX} or {@code 233XXXXXXXXX} (any separators ignored) to
     * {@code 233XXXXXXXXX}; returns null when the input is neither.
     */
    public static String normalize(String mobile) {
        if (mobile == null) {
            return null;
        }
        String cleaned = mobile.replaceAll("\\D", "");
        if (cleaned.length() == 10 && cleaned.startsWith("0")) {
            return "233" + cleaned.substring(1);
        }
        if (cleaned.length() == 12 && cleaned.startsWith("233")) {
            return cleaned;
        }
        return null;
    }

    public static boolean isValid(String mobile) {
        return normalize(mobile) != null;
    }

    /**
     * Local display form, e.g. 0550982043.
     */
    public static String toLocal(String mobile) {
        String normalized = normalize(mobile);
        if (normalized == null) {
            return mobile;
        }
        return "0" + normalized.substring(3);
    }

    /**
     * Hubtel Send Money channel for the number's prefix.
     */
    public static String sendMoneyChannel(String mobile) {
        String local = toLocal(mobile);
        String prefix = local != null && local.length() >= 3 ? local.substring(0, 3) : "";
        switch (prefix) {
            case "020":
            case "050":
                return "vodafone-gh";
            case "026":
            case "027":
            case "056":
            case "057":
                return "tigo-gh";
            default:
                return "mtn-gh";
        }
    }
}
