package com.adlanda.docretrieval.repository;

import com.adlanda.docretrieval.exception.EmbeddingMismatchException;
import com.adlanda.docretrieval.model.AddResult;
import com.adlanda.docretrieval.model.SearchHit;
import com.adlanda.docretrieval.service.EmbeddingProvider;
import com.adlanda.docretrieval.support.KeywordEmbeddingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Whole-store scenarios with two small documents.
 */
class RetrievalStoreEndToEndTest {

    private static final List<String> DOC1 = List.of(
            "fox jumps over lazy dog",
            "apples are fruit",
            "weather in Spain is sunny");

    private static final List<String> DOC2 = List.of(
            "Paris is the capital of France",
            "LLMs are AI tools",
            "the sky is blue on a clear day");

    private KeywordEmbeddingProvider embeddings;
    private RetrievalStore store;

    @BeforeEach
    void setUp() {
        embeddings = new KeywordEmbeddingProvider();
        store = new RetrievalStore(embeddings);
        store.addDocuments(DOC1, "document1.txt");
        store.addDocuments(DOC2, "document2.md");
    }

    @Test
    void search_skyQuestion_ranksSkyChunkFirst() {
        List<SearchHit> hits = store.search("What is the color of the sky?", 2);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).text()).isEqualTo("the sky is blue on a clear day");
        assertThat(hits.get(0).documentName()).isEqualTo("document2.md");
        assertThat(hits.get(0).chunkNumber()).isEqualTo(2);
        assertThat(hits.get(0).score()).isLessThan(hits.get(1).score());
    }

    @Test
    void search_capitalQuestion_ranksParisFirst() {
        List<SearchHit> hits = store.search("capital of France", 2);

        assertThat(hits.get(0).text()).isEqualTo("Paris is the capital of France");
    }

    @Test
    void search_kAboveTotal_returnsAllSixChunks() {
        List<SearchHit> hits = store.search("fox", 10);

        assertThat(hits).hasSize(6);
        assertThat(hits.get(0).text()).isEqualTo("fox jumps over lazy dog");
    }

    @Test
    void addDocuments_emptyChunks_leavesTotalUnchanged() {
        AddResult result = store.addDocuments(List.of(), "empty.md");

        assertThat(result.chunksAdded()).isZero();
        assertThat(result.totalVectors()).isEqualTo(6);
    }

    @Test
    void addDocuments_providerDropsOneVector_failsAndKeepsTotal() {
        EmbeddingProvider shortByOne = new EmbeddingProvider() {
            @Override
            public List<float[]> encode(List<String> texts) {
                List<float[]> vectors = embeddings.encode(texts);
                return vectors.subList(0, vectors.size() - 1);
            }

            @Override
            public int dimensions() {
                return embeddings.dimensions();
            }
        };
        RetrievalStore shortStore = new RetrievalStore(shortByOne);

        assertThatThrownBy(() -> shortStore.addDocuments(DOC1, "document1.txt"))
                .isInstanceOf(EmbeddingMismatchException.class);
        assertThat(shortStore.totalVectors()).isZero();
        assertThat(shortStore.search("fox", 3)).isEmpty();
    }

    @Test
    void reset_thenSearch_returnsNothing() {
        store.reset();

        assertThat(store.totalVectors()).isZero();
        assertThat(store.search("What is the color of the sky?", 2)).isEmpty();
    }
}
