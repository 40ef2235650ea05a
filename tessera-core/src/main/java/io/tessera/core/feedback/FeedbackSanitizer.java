package io.tessera.core.feedback;

import java.util.List;
import java.util.regex.Pattern;

/// Neutralizes validator-supplied text before it is embedded in agent instructions.
///
/// Validator output is untrusted: it is produced by another model and could steer
/// the next primary agent. Sanitization, in order:
/// 1. replaces known instruction-override and role-switch phrases with `[SANITIZED]`,
///    treating control characters between words as whitespace
/// 2. strips all ASCII control characters, including line breaks, and repeats the
///    phrase replacement on the result
/// 3. replaces fenced code blocks with `[CODE_BLOCK_REMOVED]`
/// 4. replaces linked images (`[![alt](img)](url)`) with `[LINK_REMOVED]`
/// 5. truncates to {@link #MAX_LENGTH} characters and trims
///
/// @implNote Stateless utility class. Safe to call from any thread.
public final class FeedbackSanitizer {

    /// Maximum sanitized length in characters.
    public static final int MAX_LENGTH = 5000;

    public static final String SANITIZED = "[SANITIZED]";
    public static final String CODE_BLOCK_REMOVED = "[CODE_BLOCK_REMOVED]";
    public static final String LINK_REMOVED = "[LINK_REMOVED]";

    static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F]");

    // word gap: whitespace or control characters
    private static final String GAP = "[\\s\\x00-\\x1F\\x7F]+";

    static final List<Pattern> INJECTION_PHRASES =
            List.of(
                    phrase("IGNORE" + GAP + "PREVIOUS" + GAP + "INSTRUCTIONS"),
                    phrase("DISREGARD" + GAP + "ALL" + GAP + "PREVIOUS"),
                    phrase("FORGET" + GAP + "EVERYTHING"),
                    phrase("NEW" + GAP + "INSTRUCTIONS"),
                    phrase("SYSTEM:"),
                    phrase("ASSISTANT:"),
                    phrase("USER:"),
                    phrase("ACT" + GAP + "AS"),
                    phrase("PRETEND" + GAP + "TO" + GAP + "BE"),
                    phrase("YOU" + GAP + "ARE" + GAP + "NOW"));

    static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");
    static final Pattern LINKED_IMAGE = Pattern.compile("\\[!\\[.*?\\]\\(.*?\\)\\]\\(.*?\\)");

    private FeedbackSanitizer() {}

    private static Pattern phrase(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /// Sanitizes a free-text value.
    ///
    /// @param text the value, may be null
    /// @return sanitized text, empty for null input
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String result = replacePhrases(text);
        result = replacePhrases(CONTROL_CHARS.matcher(result).replaceAll(""));
        result = CODE_BLOCK.matcher(result).replaceAll(CODE_BLOCK_REMOVED);
        result = LINKED_IMAGE.matcher(result).replaceAll(LINK_REMOVED);
        if (result.length() > MAX_LENGTH) {
            result = result.substring(0, MAX_LENGTH);
        }
        return result.trim();
    }

    private static String replacePhrases(String text) {
        String result = text;
        for (Pattern phrase : INJECTION_PHRASES) {
            result = phrase.matcher(result).replaceAll(SANITIZED);
        }
        return result;
    }
}
