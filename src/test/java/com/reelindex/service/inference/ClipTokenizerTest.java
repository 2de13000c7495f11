package com.reelindex.service.inference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClipTokenizerTest {

    private final ClipTokenizer tokenizer = new ClipTokenizer(
            Map.of("a</w>", 1, "b</w>", 2, "ab</w>", 3, "dog</w>", 4, "d", 5, "do", 6),
            Map.of("a b</w>", 0, "d o", 1, "do g</w>", 2));

    @Test
    void wrapsTokensInStartAndEndMarkers() {
        long[] ids = tokenizer.encode("ab dog");

        assertThat(ids).hasSize(ClipTokenizer.CONTEXT_LENGTH);
        assertThat(ids[0]).isEqualTo(ClipTokenizer.START_OF_TEXT);
        assertThat(ids[1]).isEqualTo(3);
        assertThat(ids[2]).isEqualTo(4);
        assertThat(ids[3]).isEqualTo(ClipTokenizer.END_OF_TEXT);
        assertThat(ids[4]).isZero();
    }

    @Test
    void lowercasesAndCollapsesWhitespace() {
        assertThat(tokenizer.encode("  AB \n\t DOG ")).containsExactly(tokenizer.encode("ab dog"));
    }

    @Test
    void unknownPiecesAreDropped() {
        long[] ids = tokenizer.encode("zzz");

        assertThat(ids[0]).isEqualTo(ClipTokenizer.START_OF_TEXT);
        assertThat(ids[1]).isEqualTo(ClipTokenizer.END_OF_TEXT);
    }

    @Test
    void truncatesLongInputToContextLength() {
        long[] ids = tokenizer.encode("a ".repeat(200));

        assertThat(ids).hasSize(ClipTokenizer.CONTEXT_LENGTH);
        assertThat(ids[75]).isEqualTo(1);
        assertThat(ids[76]).isEqualTo(ClipTokenizer.END_OF_TEXT);
    }

    @Test
    void loadsPairAndStringMerges(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("tokenizer.json");
        Files.writeString(json, """
                {"model": {
                  "vocab": {"a</w>": 1, "b</w>": 2, "ab</w>": 3},
                  "merges": [["a", "b</w>"], "x y"]
                }}
                """);

        assertThat(ClipTokenizer.fromFile(json).encode("ab")[1]).isEqualTo(3);
    }

    @Test
    void rejectsTokenizerWithoutVocabulary(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("tokenizer.json");
        Files.writeString(json, "{\"model\": {}}");

        assertThatThrownBy(() -> ClipTokenizer.fromFile(json)).isInstanceOf(IOException.class);
    }
}
