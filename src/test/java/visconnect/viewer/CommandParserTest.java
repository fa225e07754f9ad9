package visconnect.viewer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CommandParserTest {

    private final CommandParser parser = new CommandParser();

    @Test
    @DisplayName("Should accept abbreviations down to the minimum length")
    void testAbbreviations() {
        assertThat(CommandWord.match("sel")).isEqualTo(CommandWord.SELECT);
        assertThat(CommandWord.match("SELECT")).isEqualTo(CommandWord.SELECT);
        assertThat(CommandWord.match("so")).isEqualTo(CommandWord.SORT);
        assertThat(CommandWord.match("spec")).isEqualTo(CommandWord.SPECTRUM);
        assertThat(CommandWord.match("tv")).isEqualTo(CommandWord.TVCHANNELS);
        assertThat(CommandWord.match("ts")).isEqualTo(CommandWord.TSYSCORR);
        assertThat(CommandWord.match("q")).isEqualTo(CommandWord.QUIT);
        assertThat(CommandWord.match("del")).isEqualTo(CommandWord.DELAVG);
        assertThat(CommandWord.match("des")).isEqualTo(CommandWord.DESCRIBE);
    }

    @Test
    @DisplayName("Should reject words that are too short, too long or unknown")
    void testRejections() {
        assertThat(CommandWord.match("se")).isNull();
        assertThat(CommandWord.match("spe")).isNull();
        assertThat(CommandWord.match("ex")).isNull();
        assertThat(CommandWord.match("selection")).isNull();
        assertThat(CommandWord.match("frobnicate")).isNull();
        assertThat(MinMatch.matches("select", "SEL", 3)).isTrue();
        assertThat(MinMatch.matches("select", "sex", 3)).isFalse();
        assertThat(MinMatch.matches("sort", null, 2)).isFalse();
    }

    @Test
    @DisplayName("Should treat commas as spaces when splitting arguments")
    void testCommas() {
        Command command = parser.parse("  array 1,2, 3  ").orElseThrow();

        assertThat(command.word()).isEqualTo(CommandWord.ARRAY);
        assertThat(command.args()).containsExactly("1", "2", "3");
        assertThat(command.arg(2)).isEqualTo("3");
    }

    @Test
    @DisplayName("Should return nothing for blank or unknown lines")
    void testBlankAndUnknown() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("plot everything")).isEmpty();
        assertThat(CommandParser.tokenize(",,")).isEmpty();
        assertThat(parser.parse("quit").orElseThrow().hasArgs()).isFalse();
    }
}
