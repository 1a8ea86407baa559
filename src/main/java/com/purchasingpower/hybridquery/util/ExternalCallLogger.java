package com.purchasingpower.hybridquery.util;

import com.purchasingpower.hybridquery.model.CallContext;
import com.purchasingpower.hybridquery.model.ServiceType;
import org.slf4j.Logger;

import java.util.Collection;

/**
 * Structured request/response logging for store collaborator calls.
 */
public final class ExternalCallLogger {

    private static final int MAX_LOGGED_IDS = 5;

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Compact rendering of a candidate id set; {@code null} means unconstrained.
     */
    public static String formatIds(Collection<String> ids) {
        if (ids == null) {
            return "(all)";
        }
        if (ids.size() <= MAX_LOGGED_IDS) {
            return ids.toString();
        }
        return "{" + ids.size() + " ids}";
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
