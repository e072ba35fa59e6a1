package io.pactkit.core.api;

import io.pactkit.core.error.LastError;
import io.pactkit.core.generators.DateExpressions;
import io.pactkit.core.generators.RegexValueGenerator;
import io.pactkit.core.matchers.expressions.MatcherExpressionParser;
import io.pactkit.core.matchers.expressions.ParseError;
import io.pactkit.core.matchers.expressions.ParseResult;
import java.security.SecureRandom;
import java.time.DateTimeException;
import java.util.Random;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Stand-alone matcher utilities. Failures return {@code null} or {@code false} and set {@link LastError}. */
public final class MatcherApi {

    private static final Random RANDOM = new SecureRandom();

    private MatcherApi() {}

    /** Parses a matcher expression such as {@code matching(regex, '\\d+', '100')}. */
    public static MatcherDefinitionResult parseMatcherDefinition(String expression) {
        if (expression == null) {
            LastError.record("expression is required");
            return MatcherDefinitionResult.failure(
                    new ParseError("Expression is null", "", 0));
        }
        ParseResult result = MatcherExpressionParser.parse(expression);
        if (result instanceof ParseResult.Failure failure) {
            LastError.record(failure.error().describe());
            return MatcherDefinitionResult.failure(failure.error());
        }
        return MatcherDefinitionResult.success(((ParseResult.Success) result).definition());
    }

    /** True if {@code example} fully matches {@code regex}; an invalid regex gives {@code false}. */
    public static boolean checkRegex(String regex, String example) {
        if (regex == null || example == null) {
            LastError.record("regex and example are required");
            return false;
        }
        try {
            return Pattern.compile(regex).matcher(example).matches();
        } catch (PatternSyntaxException e) {
            LastError.record("Invalid regex '" + regex + "': " + e.getDescription());
            return false;
        }
    }

    /** A random string matching {@code regex}, or {@code null} if none can be produced. */
    public static String generateRegexValue(String regex) {
        return generateRegexValue(regex, RANDOM);
    }

    static String generateRegexValue(String regex, Random random) {
        if (regex == null) {
            LastError.record("regex is required");
            return null;
        }
        try {
            return RegexValueGenerator.generate(regex, random);
        } catch (IllegalArgumentException e) {
            LastError.record(e);
            return null;
        }
    }

    /** The current date-time rendered with {@code format}, or {@code null} for an invalid format. */
    public static String generateDatetimeString(String format) {
        if (format == null) {
            LastError.record("format is required");
            return null;
        }
        try {
            return DateExpressions.render(DateExpressions.Kind.DATE_TIME, format, null);
        } catch (IllegalArgumentException | DateTimeException e) {
            LastError.record("Invalid date-time format '" + format + "': " + e.getMessage());
            return null;
        }
    }
}
