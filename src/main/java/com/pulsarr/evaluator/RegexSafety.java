package com.pulsarr.evaluator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Guards user-authored regular expressions against catastrophic backtracking.
 * Patterns with nested quantifiers or backreferences are rejected instead of being run.
 */
public final class RegexSafety {

    private static final Logger log = LoggerFactory.getLogger(RegexSafety.class);

    static final int MAX_PATTERN_LENGTH = 256;
    static final int MAX_INPUT_LENGTH = 1024;

    // a quantified group whose body is itself quantified: (a+)+, (\w*)*, (x{2,})+
    private static final Pattern NESTED_QUANTIFIER =
            Pattern.compile("\\((?:[^()\\\\]|\\\\.)*[+*}](?:[^()\\\\]|\\\\.)*\\)\\s*(?:[+*]|\\{\\d+,\\d*})");
    private static final Pattern BACKREFERENCE = Pattern.compile("\\\\[1-9]|\\\\k<");

    private RegexSafety() {
    }

    public static boolean isSafe(String regex) {
        if (regex == null || regex.isEmpty() || regex.length() > MAX_PATTERN_LENGTH) {
            return false;
        }
        return !NESTED_QUANTIFIER.matcher(regex).find() && !BACKREFERENCE.matcher(regex).find();
    }

    /**
     * Compile a pattern case-insensitively if it is safe and valid.
     */
    public static Optional<Pattern> compile(String regex) {
        if (!isSafe(regex)) {
            log.warn("Rejected unsafe or oversized regex: {}", regex);
            return Optional.empty();
        }
        try {
            return Optional.of(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex '{}': {}", regex, e.getDescription());
            return Optional.empty();
        }
    }

    public static boolean find(Pattern pattern, String input) {
        if (input == null || input.length() > MAX_INPUT_LENGTH) {
            return false;
        }
        return pattern.matcher(input).find();
    }
}
