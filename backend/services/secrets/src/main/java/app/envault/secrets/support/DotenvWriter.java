package app.envault.secrets.support;

import java.util.Map;

/**
 * Renders key/value pairs as a dotenv file. Values are always double quoted so that
 * whitespace, {@code #} and {@code =} survive a round trip through common dotenv parsers.
 */
public final class DotenvWriter {

    private DotenvWriter() {
    }

    public static String write(Map<String, String> entries) {
        StringBuilder sb = new StringBuilder();
        entries.forEach((key, value) -> sb.append(key).append('=').append(quote(value)).append('\n'));
        return sb.toString();
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '$' -> sb.append("\\$");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
