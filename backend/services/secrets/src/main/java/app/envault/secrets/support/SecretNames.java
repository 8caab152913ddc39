package app.envault.secrets.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalization of secret paths, keys and tags, shared by every request type.
 */
public final class SecretNames {

    public static final String ROOT_PATH = "/";

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
    private static final int MAX_KEY_LENGTH = 256;
    private static final int MAX_PATH_LENGTH = 512;
    private static final int MAX_TAG_LENGTH = 64;

    private SecretNames() {
    }

    public static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            return ROOT_PATH;
        }
        String trimmed = path.trim();
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.contains("//")) {
            throw new IllegalArgumentException("path must not contain empty segments");
        }
        if (trimmed.length() > MAX_PATH_LENGTH) {
            throw new IllegalArgumentException("path is longer than " + MAX_PATH_LENGTH + " characters");
        }
        return trimmed;
    }

    public static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
        String trimmed = key.trim();
        if (trimmed.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("key is longer than " + MAX_KEY_LENGTH + " characters");
        }
        if (!KEY_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("key must start with a letter or underscore and contain only letters, digits, '_', '.' or '-'");
        }
        return trimmed;
    }

    public static List<String> normalizeTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            String trimmed = tag.trim();
            if (trimmed.length() > MAX_TAG_LENGTH) {
                throw new IllegalArgumentException("tag is longer than " + MAX_TAG_LENGTH + " characters");
            }
            normalized.add(trimmed);
        }
        return new ArrayList<>(normalized);
    }

    /**
     * Escapes {@code %}, {@code _} and {@code \} for a JPQL LIKE with escape character {@code \}.
     */
    public static String escapeLike(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '%' || c == '_' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static String searchPattern(String search) {
        if (search == null || search.isBlank()) {
            return "";
        }
        return escapeLike(search.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Normalized path a prefix filter is anchored at, or {@code ""} when the filter covers every path.
     */
    public static String pathScope(String pathPrefix) {
        if (pathPrefix == null || pathPrefix.isBlank()) {
            return "";
        }
        String normalized = normalizePath(pathPrefix);
        return ROOT_PATH.equals(normalized) ? "" : normalized;
    }

    /**
     * LIKE pattern for the paths strictly below {@link #pathScope(String)}, escaped and ending in {@code /}
     * so that {@code /db} never matches {@code /dbx}. Empty when the filter covers every path.
     */
    public static String pathPrefixPattern(String pathPrefix) {
        String scope = pathScope(pathPrefix);
        return scope.isEmpty() ? "" : escapeLike(scope) + "/";
    }
}
