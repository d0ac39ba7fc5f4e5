package com.enterprise.dataprocessor.post.infrastructure;

import java.util.Locale;

/** Number formatting for log lines, independent of the default locale. */
final class LogFormat {

    private LogFormat() {
    }

    static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
