package org.courier.logging;

import java.util.regex.Pattern;

/**
 * Masks identifying values in log lines: hex key material, hex message and contact ids, server ids.
 */
public final class Scrubber {

    private static final Pattern keyPattern = Pattern.compile("\\b[0-9a-f]{32,}\\b");
    private static final Pattern idPattern = Pattern.compile("\\b(?=[0-9]*[a-f])[0-9a-f]{8,16}\\b");
    private static final Pattern serverPattern = Pattern.compile("(pondserver://)[A-Z2-7]+=*@");

    private Scrubber() {
    }

    public static CharSequence scrub(CharSequence s) {
        s = scrubKeys(s);
        s = scrubIds(s);
        s = scrubServers(s);
        return s;
    }

    private static CharSequence scrubKeys(CharSequence s) {
        return keyPattern.matcher(s).replaceAll(m -> m.group().substring(0, 4) + "*".repeat(m.group().length() - 4));
    }

    private static CharSequence scrubIds(CharSequence s) {
        return idPattern.matcher(s).replaceAll(m -> "*".repeat(m.group().length() - 2) + m.group().substring(
                m.group().length() - 2));
    }

    private static CharSequence scrubServers(CharSequence s) {
        return serverPattern.matcher(s).replaceAll("$1[REDACTED]@");
    }
}
