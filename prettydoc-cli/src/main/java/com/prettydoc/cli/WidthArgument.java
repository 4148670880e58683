package com.prettydoc.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient parsing of the column budget argument.
 */
public final class WidthArgument {

    private static final Logger log = LoggerFactory.getLogger(WidthArgument.class);

    private WidthArgument() {
        // Utility class
    }

    /**
     * Parses a decimal column budget.
     *
     * <p>A missing, unparseable or negative value yields {@code fallback}.
     *
     * @param raw raw argument, may be null
     * @param fallback width to use when {@code raw} is not a usable width
     * @return parsed width or {@code fallback}
     */
    public static int parse(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }

        try {
            int width = Integer.parseInt(raw.trim());
            if (width < 0) {
                log.warn("Width must not be negative: {}. Using {}.", raw, fallback);
                return fallback;
            }
            return width;
        } catch (NumberFormatException e) {
            log.warn("Invalid width: '{}'. Using {}.", raw, fallback);
            return fallback;
        }
    }
}
