package club.ppmc.bridge.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LineFramerTest {

    private LineFramer framer;

    @BeforeEach
    void setUp() {
        framer = new LineFramer();
    }

    @Test
    void emitsNothingUntilTheDelimiterArrives() {
        assertThat(framer.feed("{\"jsonrpc\":\"2.0\"")).isEmpty();
        assertThat(framer.residual()).isEqualTo("{\"jsonrpc\":\"2.0\"");
    }

    @Test
    void reassemblesLineSplitAcrossTwoChunks() {
        assertThat(framer.feed("li")).isEmpty();
        assertThat(framer.feed("ne1\nline2\n")).containsExactly("line1", "line2");
        assertThat(framer.hasResidual()).isFalse();
    }

    @Test
    void reassemblesLineSplitIntoSingleCharacters() {
        String line = "{\"id\":1,\"result\":{\"tools\":[]}}";
        List<String> emitted = new ArrayList<>();
        for (char c : (line + "\n").toCharArray()) {
            emitted.addAll(framer.feed(String.valueOf(c)));
        }
        assertThat(emitted).containsExactly(line);
    }

    @Test
    void keepsTrailingPartialLineAsResidual() {
        assertThat(framer.feed("a\nb\nc")).containsExactly("a", "b");
        assertThat(framer.residual()).isEqualTo("c");
        assertThat(framer.feed("d\n")).containsExactly("cd");
    }

    @Test
    void dropsEmptyAndWhitespaceOnlyLines() {
        assertThat(framer.feed("\n\n  \t\nreal\n\r\n")).containsExactly("real");
    }

    @Test
    void trimsCarriageReturnsAndSurroundingWhitespace() {
        assertThat(framer.feed("  {\"a\":1}\r\n")).containsExactly("{\"a\":1}");
    }

    @Test
    void preservesInteriorWhitespace() {
        assertThat(framer.feed("{\"text\": \"two  spaces\"}\n")).containsExactly("{\"text\": \"two  spaces\"}");
    }

    @Test
    void ignoresEmptyChunks() {
        framer.feed("abc");
        assertThat(framer.feed("")).isEmpty();
        assertThat(framer.feed(null)).isEmpty();
        assertThat(framer.residual()).isEqualTo("abc");
    }

    @Test
    void clearDropsResidual() {
        framer.feed("partial");
        framer.clear();
        assertThat(framer.feed("\n")).isEmpty();
    }

    @Test
    void longLineFedInSmallChunksStaysLinear() {
        String piece = "x".repeat(8 * 1024);
        int chunks = 2 * 1024;

        List<String> emitted = assertTimeout(Duration.ofSeconds(2), () -> {
            List<String> out = new ArrayList<>();
            for (int i = 0; i < chunks; i++) {
                out.addAll(framer.feed(piece));
            }
            out.addAll(framer.feed("\n"));
            return out;
        });

        assertThat(emitted).hasSize(1);
        assertThat(emitted.get(0)).hasSize(piece.length() * chunks);
    }

    @Test
    void handlesMultiByteCharacters() {
        assertThat(framer.feed("héllo 世")).isEmpty();
        assertThat(framer.feed("界\n")).containsExactly("héllo 世界");
    }
}
