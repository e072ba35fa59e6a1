package io.pactkit.core.generators;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.model.JsonValues;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Resolves {@code ${name}} expressions against provider-state parameters. */
public final class ProviderStateExpressions {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private ProviderStateExpressions() {}

    /**
     * Evaluates an expression. An expression that is exactly one placeholder yields the parameter
     * value unchanged (so numbers stay numbers); anything else yields a string with every placeholder
     * substituted.
     *
     * @throws IllegalArgumentException if a placeholder names a missing parameter
     */
    public static JsonNode evaluate(String expression, Map<String, JsonNode> params) {
        Matcher whole = PLACEHOLDER.matcher(expression);
        if (whole.matches()) {
            return lookup(whole.group(1).trim(), params, expression);
        }
        Matcher m = PLACEHOLDER.matcher(expression);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            JsonNode value = lookup(m.group(1).trim(), params, expression);
            m.appendReplacement(sb, Matcher.quoteReplacement(JsonValues.asString(value)));
        }
        m.appendTail(sb);
        return TextNode.valueOf(sb.toString());
    }

    private static JsonNode lookup(String key, Map<String, JsonNode> params, String expression) {
        JsonNode value = params.get(key);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Provider state parameter '" + key + "' required by expression '" + expression + "' is not set");
        }
        return value;
    }
}
