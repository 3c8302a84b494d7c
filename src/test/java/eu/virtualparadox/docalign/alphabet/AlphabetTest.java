package eu.virtualparadox.docalign.alphabet;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlphabetTest {

    private final Alphabet alphabet = Alphabet.fromLines("test alphabet", List.of(
            "# comment line",
            " ",
            "a",
            "b",
            "",
            "\\#",
            "c"
    ));

    @Test
    void testLabelsFollowFileOrder() {
        assertThat(alphabet.size()).isEqualTo(5);
        assertThat(alphabet.labelFromString(" ")).isZero();
        assertThat(alphabet.labelFromString("a")).isEqualTo(1);
        assertThat(alphabet.labelFromString("#")).isEqualTo(3);
        assertThat(alphabet.stringFromLabel(4)).isEqualTo("c");
    }

    @Test
    void testCommentsAreNotLabels() {
        assertThat(alphabet.hasLabel("# comment line")).isFalse();
        assertThat(alphabet.isPermitted('#')).isTrue();
        assertThat(alphabet.isPermitted('d')).isFalse();
    }

    @Test
    void testEncodeDecode() {
        int[] labels = alphabet.encode("ab c#");
        assertThat(labels).containsExactly(1, 2, 0, 4, 3);
        assertThat(alphabet.decode(labels)).isEqualTo("ab c#");
    }

    @Test
    void testUnknownCharacterNamesRemedy() {
        assertThatThrownBy(() -> alphabet.encode("abz"))
                .isInstanceOf(UnknownCharacterException.class)
                .hasMessageContaining("'z'")
                .hasMessageContaining("test alphabet")
                .hasMessageContaining("Add all characters");
    }

    @Test
    void testReadFromStream() throws IOException {
        byte[] content = "# header\r\nx\r\ny\r\n".getBytes(StandardCharsets.UTF_8);
        Alphabet read = Alphabet.read("stream", new ByteArrayInputStream(content));

        assertThat(read.size()).isEqualTo(2);
        assertThat(read.labelFromString("y")).isEqualTo(1);
    }

    @Test
    void testBundledAlphabet() throws IOException {
        Alphabet bundled = Alphabet.load(new ClassPathResource("alphabet.txt"));

        assertThat(bundled.size()).isEqualTo(28);
        assertThat(bundled.isPermitted(' ')).isTrue();
        assertThat(bundled.isPermitted('\'')).isTrue();
        assertThat(bundled.isPermitted('q')).isTrue();
        assertThat(bundled.isPermitted('Q')).isFalse();
        assertThat(bundled.isPermitted('-')).isFalse();
    }
}
