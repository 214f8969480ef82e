package io.agentrelay.observability;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs credentials out of strings before they reach logs or event files.
 */
public final class SensitiveDataMasker {
    static final String MASK = "***";
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "(?i)\\b([a-z0-9_\\-]*(?:password|passwd|secret|token|authorization|apikey|api_key|credential)[a-z0-9_\\-]*)(\\s*[=:]\\s*)(\"[^\"]*\"|[^\\s,;&]+)"
    );
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("[A-Za-z0-9+/=_\\-:.]{24,}");
    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9+/=_\\-.]+");

    private SensitiveDataMasker() {
    }

    public static String maskText(String raw) {
        if (raw == null || raw.isEmpty()) {
            return raw;
        }
        String out = BEARER.matcher(raw).replaceAll("Bearer " + MASK);
        Matcher assignment = ASSIGNMENT.matcher(out);
        StringBuilder sb = new StringBuilder();
        while (assignment.find()) {
            assignment.appendReplacement(sb, Matcher.quoteReplacement(assignment.group(1) + assignment.group(2) + MASK));
        }
        assignment.appendTail(sb);
        out = sb.toString();
        Matcher token = OPAQUE_TOKEN.matcher(out);
        sb = new StringBuilder();
        while (token.find()) {
            String candidate = token.group();
            // High-entropy heuristic: long opaque strings mixing letters and digits.
            boolean opaque = candidate.chars().anyMatch(Character::isDigit)
                    && candidate.chars().anyMatch(Character::isLetter);
            token.appendReplacement(sb, Matcher.quoteReplacement(opaque ? MASK : candidate));
        }
        token.appendTail(sb);
        return sb.toString();
    }
}
