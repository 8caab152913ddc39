package app.envault.secrets.support;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DotenvWriterTest {

    @Test
    void writesOneQuotedLinePerEntryInOrder() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("DB_HOST", "localhost");
        entries.put("DB_PASSWORD", "s3cr3t! # not a comment");

        assertThat(DotenvWriter.write(entries))
                .isEqualTo("DB_HOST=\"localhost\"\nDB_PASSWORD=\"s3cr3t! # not a comment\"\n");
    }

    @Test
    void escapesQuotesBackslashesNewlinesAndDollar() {
        assertThat(DotenvWriter.quote("a\"b\\c\nd\re$HOME"))
                .isEqualTo("\"a\\\"b\\\\c\\nd\\re\\$HOME\"");
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(DotenvWriter.write(Map.of())).isEmpty();
    }
}
