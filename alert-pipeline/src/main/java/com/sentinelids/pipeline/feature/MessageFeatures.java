package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical features of the sensor message.
 *
 * @author Naveed Gung
 */
final class MessageFeatures implements FeatureExtractor.FeatureGroup {

    private static final Pattern SPECIAL = Pattern.compile("[^a-zA-Z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public int width() {
        return 6;
    }

    @Override
    public void extract(RawAlert alert, double[] into, int offset) {
        String message = alert.message();
        String lower = message.toLowerCase(Locale.ROOT);
        into[offset] = message.codePointCount(0, message.length());
        into[offset + 1] = tokenCount(message);
        into[offset + 2] = specialCharCount(message);
        into[offset + 3] = lower.contains("attack") ? 1.0 : 0.0;
        into[offset + 4] = lower.contains("scan") ? 1.0 : 0.0;
        into[offset + 5] = lower.contains("exploit") ? 1.0 : 0.0;
    }

    static int tokenCount(String message) {
        String trimmed = message.strip();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    static int specialCharCount(String message) {
        Matcher matcher = SPECIAL.matcher(message);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
