package io.kairon.core.rule;

import java.util.Objects;
import java.util.regex.Pattern;

/// A regex heuristic over embedded code paired with the message reported on a match.
///
/// @param pattern compiled predicate, searched anywhere in the code
/// @param message finding reported when the pattern is found
public record CodePattern(Pattern pattern, String message) {

    public CodePattern {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static CodePattern of(String regex, String message) {
        return new CodePattern(Pattern.compile(regex), message);
    }

    public boolean matches(String code) {
        return code != null && pattern.matcher(code).find();
    }
}
