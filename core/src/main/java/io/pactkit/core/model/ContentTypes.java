package io.pactkit.core.model;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Helpers for media-type strings such as {@code application/json; charset=UTF-8}. */
public final class ContentTypes {

    public static final String JSON = "application/json";
    public static final String TEXT = "text/plain";
    public static final String XML = "application/xml";
    public static final String OCTET_STREAM = "application/octet-stream";

    private ContentTypes() {}

    /** Lower-cased {@code type/subtype} without parameters, or {@code null}. */
    public static String baseType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    /** Parameters after the base type, keys lower-cased, values unquoted. */
    public static Map<String, String> parameters(String contentType) {
        Map<String, String> params = new LinkedHashMap<>();
        if (contentType == null) {
            return params;
        }
        String[] parts = contentType.split(";");
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i].trim();
            int eq = part.indexOf('=');
            if (eq > 0) {
                String value = part.substring(eq + 1).trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                params.put(part.substring(0, eq).trim().toLowerCase(Locale.ROOT), value);
            }
        }
        return params;
    }

    /** True for {@code application/json} and any {@code +json} structured suffix. */
    public static boolean isJson(String contentType) {
        String base = baseType(contentType);
        return base != null && (base.equals(JSON) || base.endsWith("+json") || base.equals("text/json"));
    }

    /** True for {@code application/xml}, {@code text/xml} and any {@code +xml} suffix. */
    public static boolean isXml(String contentType) {
        String base = baseType(contentType);
        return base != null && (base.equals(XML) || base.equals("text/xml") || base.endsWith("+xml"));
    }

    /** True for media types whose bodies are text: JSON, XML, {@code text/*} and form data. */
    public static boolean isText(String contentType) {
        String base = baseType(contentType);
        if (base == null) {
            return false;
        }
        return isJson(base)
                || isXml(base)
                || base.startsWith("text/")
                || base.equals("application/x-www-form-urlencoded")
                || base.equals("application/javascript");
    }

    /** True if both media types name the same base type, treating JSON and XML families as equal. */
    public static boolean sameFamily(String expected, String actual) {
        if (isJson(expected)) {
            return isJson(actual);
        }
        if (isXml(expected)) {
            return isXml(actual);
        }
        String e = baseType(expected);
        return e != null && e.equals(baseType(actual));
    }

    /**
     * Guesses the media type of raw content: JSON if it parses as an object or array, XML if it
     * starts with a tag, text if it is printable, octet-stream otherwise.
     */
    public static String sniff(String content) {
        if (content == null) {
            return OCTET_STREAM;
        }
        String trimmed = content.trim();
        if ((trimmed.startsWith("{") || trimmed.startsWith("[")) && JsonValues.tryParse(trimmed) != null) {
            return JSON;
        }
        if (trimmed.startsWith("<") && trimmed.endsWith(">")) {
            return XML;
        }
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (Character.isISOControl(c) && !Character.isWhitespace(c)) {
                return OCTET_STREAM;
            }
        }
        return TEXT;
    }

    /** Guesses the media type of binary content from its leading bytes, then as text. */
    public static String detect(byte[] data) {
        if (data == null) {
            return OCTET_STREAM;
        }
        if (startsWith(data, 0x89, 'P', 'N', 'G')) {
            return "image/png";
        }
        if (startsWith(data, 0xFF, 0xD8, 0xFF)) {
            return "image/jpeg";
        }
        if (startsWith(data, 'G', 'I', 'F', '8')) {
            return "image/gif";
        }
        if (startsWith(data, '%', 'P', 'D', 'F')) {
            return "application/pdf";
        }
        if (startsWith(data, 'P', 'K', 3, 4)) {
            return "application/zip";
        }
        if (startsWith(data, 0x1F, 0x8B)) {
            return "application/gzip";
        }
        return sniff(new String(data, StandardCharsets.UTF_8));
    }

    private static boolean startsWith(byte[] data, int... magic) {
        if (data.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if ((data[i] & 0xFF) != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
