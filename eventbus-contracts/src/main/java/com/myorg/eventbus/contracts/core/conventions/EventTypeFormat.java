package com.myorg.eventbus.contracts.core.conventions;

import java.util.regex.Pattern;

public final class EventTypeFormat {
    private EventTypeFormat() {}

    // e.g. tenant.created, billing.payment_succeeded
    public static final String RECOMMENDED_PATTERN = "<domain>.<action>";

    private static final Pattern DOTTED = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)+");

    public static boolean isValid(String type) {
        return type != null && DOTTED.matcher(type).matches();
    }

    /** Domain segment of a dotted type, or {@code null} when the type is not dotted. */
    public static String domainOf(String type) {
        if (type == null) return null;
        int dot = type.indexOf('.');
        return dot > 0 ? type.substring(0, dot) : null;
    }
}
