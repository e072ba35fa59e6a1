package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.model.JsonValues;

/**
 * One difference between an expected and an actual request, response or message. Each variant
 * carries enough detail (location, expected, actual, description) to render a diff without
 * re-running the match.
 */
public sealed interface Mismatch {

    /** Variant name written as {@code type} in JSON output. */
    String type();

    /** Human-readable description. */
    String description();

    /** JSON form with a {@code type} discriminator. */
    ObjectNode toJson();

    private static ObjectNode base(String type) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("type", type);
        return node;
    }

    record MethodMismatch(String expected, String actual) implements Mismatch {
        @Override
        public String type() {
            return "MethodMismatch";
        }

        @Override
        public String description() {
            return String.format("Expected method of %s but received %s", expected, actual);
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("expected", expected).put("actual", actual).put("mismatch", description());
        }
    }

    record PathMismatch(String expected, String actual, String mismatch) implements Mismatch {
        @Override
        public String type() {
            return "PathMismatch";
        }

        @Override
        public String description() {
            return mismatch;
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("expected", expected).put("actual", actual).put("mismatch", mismatch);
        }
    }

    record StatusMismatch(int expected, int actual, String mismatch) implements Mismatch {
        @Override
        public String type() {
            return "StatusMismatch";
        }

        @Override
        public String description() {
            return mismatch;
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("expected", expected).put("actual", actual).put("mismatch", mismatch);
        }
    }

    record QueryMismatch(String parameter, String expected, String actual, String mismatch) implements Mismatch {
        @Override
        public String type() {
            return "QueryMismatch";
        }

        @Override
        public String description() {
            return mismatch;
        }

        @Override
        public ObjectNode toJson() {
            return base(type())
                    .put("parameter", parameter)
                    .put("expected", expected)
                    .put("actual", actual)
                    .put("mismatch", mismatch);
        }
    }

    record HeaderMismatch(String key, String expected, String actual, String mismatch) implements Mismatch {
        @Override
        public String type() {
            return "HeaderMismatch";
        }

        @Override
        public String description() {
            return mismatch;
        }

        @Override
        public ObjectNode toJson() {
            return base(type())
                    .put("key", key)
                    .put("expected", expected)
                    .put("actual", actual)
                    .put("mismatch", mismatch);
        }
    }

    record BodyTypeMismatch(String expected, String actual, String mismatch) implements Mismatch {
        @Override
        public String type() {
            return "BodyTypeMismatch";
        }

        @Override
        public String description() {
            return mismatch;
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("expected", expected).put("actual", actual).put("mismatch", mismatch);
        }
    }

    /**
     * A difference inside a body.
     *
     * @param path     document path of the difference, e.g. {@code $.items[1].id}
     * @param expected expected value at the path, or {@code null}
     * @param actual   actual value at the path, or {@code null} when missing
     * @param mismatch description, including the rule that failed
     */
    record BodyMismatch(String path, JsonNode expected, JsonNode actual, String mismatch) implements Mismatch {
        @Override
        public String type() {
            return "BodyMismatch";
        }

        @Override
        public String description() {
            return mismatch;
        }

        /** Returns a copy whose path has {@code $} replaced by {@code base}. */
        public BodyMismatch relocate(String base) {
            String relocated = path.startsWith("$") ? base + path.substring(1) : path;
            return new BodyMismatch(relocated, expected, actual, mismatch);
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode node = base(type()).put("path", path);
            node.set("expected", expected);
            node.set("actual", actual);
            return node.put("mismatch", mismatch);
        }
    }

    record MetadataMismatch(String key, String expected, String actual, String mismatch) implements Mismatch {
        @Override
        public String type() {
            return "MetadataMismatch";
        }

        @Override
        public String description() {
            return mismatch;
        }

        @Override
        public ObjectNode toJson() {
            return base(type())
                    .put("key", key)
                    .put("expected", expected)
                    .put("actual", actual)
                    .put("mismatch", mismatch);
        }
    }
}
