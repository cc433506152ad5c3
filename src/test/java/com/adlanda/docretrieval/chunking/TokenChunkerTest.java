package com.adlanda.docretrieval.chunking;

import com.adlanda.docretrieval.model.TextChunk;
import com.adlanda.docretrieval.support.WordTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenChunkerTest {

    private TokenChunker chunker;

    @BeforeEach
    void setUp() {
        chunker = new TokenChunker(new WordTokenizer());
    }

    @Test
    void chunk_emptyText_returnsEmptyList() {
        assertThat(chunker.chunk("", 10, 2)).isEmpty();
    }

    @Test
    void chunk_whitespaceOnly_returnsEmptyList() {
        assertThat(chunker.chunk("   \n\t  ", 10, 2)).isEmpty();
    }

    @Test
    void chunk_unicodeSpacesOnly_returnsEmptyList() {
        assertThat(chunker.chunk("\u00A0\u00A0\u2007\u202F", 10, 2)).isEmpty();
        assertThat(chunker.chunk("\u3000\n\u00A0", 10, 2)).isEmpty();
    }

    @Test
    void isBlank_countsUnicodeSpaceSeparators() {
        assertThat(TokenChunker.isBlank("\u00A0\u2007\u202F")).isTrue();
        assertThat(TokenChunker.isBlank(null)).isTrue();
        assertThat(TokenChunker.isBlank("\u00A0word\u00A0")).isFalse();
    }

    @Test
    void chunk_nullText_returnsEmptyList() {
        assertThat(chunker.chunk(null, 10, 2)).isEmpty();
    }

    @Test
    void chunk_textWithinChunkSize_returnsSingleChunk() {
        List<String> chunks = chunker.chunk("the quick brown fox", 4, 1);

        assertThat(chunks).containsExactly("the quick brown fox");
    }

    @Test
    void chunk_windowsAdvanceByStride() {
        List<String> chunks = chunker.chunk(WordTokenizer.words(10), 4, 1);

        assertThat(chunks).containsExactly(
                "w0 w1 w2 w3",
                "w3 w4 w5 w6",
                "w6 w7 w8 w9");
    }

    @Test
    void chunk_noOverlap_producesDisjointWindows() {
        List<String> chunks = chunker.chunk(WordTokenizer.words(10), 5, 0);

        assertThat(chunks).containsExactly("w0 w1 w2 w3 w4", "w5 w6 w7 w8 w9");
    }

    @Test
    void chunk_shortTail_lastChunkIsShorter() {
        List<TextChunk> chunks = chunker.chunkWithCounts(WordTokenizer.words(11), 4, 1);

        assertThat(chunks).extracting(TextChunk::tokenCount).containsExactly(4, 4, 4, 2);
        assertThat(chunks.get(3).text()).isEqualTo("w9 w10");
    }

    @ParameterizedTest
    @CsvSource({
            "37, 8, 3",
            "100, 10, 0",
            "25, 7, 6",
            "50, 50, 10",
            "9, 2, 1"
    })
    void chunk_overlapRemoved_reconstructsOriginalTokens(int words, int chunkSize, int overlap) {
        String text = WordTokenizer.words(words);

        List<String> chunks = chunker.chunk(text, chunkSize, overlap);

        List<String> rebuilt = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            List<String> tokens = Arrays.asList(chunks.get(i).split(" "));
            assertThat(tokens.size()).isLessThanOrEqualTo(chunkSize);
            rebuilt.addAll(i == 0 ? tokens : tokens.subList(overlap, tokens.size()));
        }
        assertThat(String.join(" ", rebuilt)).isEqualTo(text);
    }

    @Test
    void chunk_overlapEqualToChunkSize_stillTerminates() {
        List<String> chunks = chunker.chunk(WordTokenizer.words(10), 4, 4);

        assertThat(chunks).containsExactly(
                "w0 w1 w2 w3",
                "w2 w3 w4 w5",
                "w4 w5 w6 w7",
                "w6 w7 w8 w9");
    }

    @Test
    void chunk_overlapLargerThanChunkSize_stillTerminates() {
        List<String> chunks = chunker.chunk(WordTokenizer.words(10), 4, 9);

        assertThat(chunks).hasSize(4);
        assertThat(chunks.get(chunks.size() - 1)).endsWith("w9");
    }

    @Test
    void chunk_singleTokenWindowWithFullOverlap_advancesOneTokenAtATime() {
        List<String> chunks = chunker.chunk(WordTokenizer.words(5), 1, 1);

        assertThat(chunks).containsExactly("w0", "w1", "w2", "w3", "w4");
    }

    @Test
    void chunk_isRestartable() {
        String text = WordTokenizer.words(20);

        assertThat(chunker.chunk(text, 6, 2)).isEqualTo(chunker.chunk(text, 6, 2));
    }

    @Test
    void chunk_nonPositiveChunkSize_throwsException() {
        assertThatThrownBy(() -> chunker.chunk("some text", 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chunkSize");
    }

    @Test
    void chunk_negativeOverlap_throwsException() {
        assertThatThrownBy(() -> chunker.chunk("some text", 5, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chunkOverlap");
    }
}
