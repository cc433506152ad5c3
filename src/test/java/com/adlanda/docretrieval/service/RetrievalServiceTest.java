package com.adlanda.docretrieval.service;

import com.adlanda.docretrieval.config.RetrievalProperties;
import com.adlanda.docretrieval.model.QueryResponse;
import com.adlanda.docretrieval.model.SearchHit;
import com.adlanda.docretrieval.repository.RetrievalStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceTest {

    @Mock
    private RetrievalStore retrievalStore;

    private RetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        RetrievalProperties properties = new RetrievalProperties();
        properties.setMaxContextChunks(5);
        retrievalService = new RetrievalService(retrievalStore, properties);
    }

    @Test
    void query_withoutMaxResults_usesConfiguredDefault() {
        when(retrievalStore.search("question", 5)).thenReturn(List.of());

        retrievalService.query("question", null);

        verify(retrievalStore).search("question", 5);
    }

    @Test
    void query_withMaxResults_passesToStore() {
        SearchHit hit = new SearchHit("doc.md", 0, "text", 0.25);
        when(retrievalStore.search("question", 2)).thenReturn(List.of(hit));
        when(retrievalStore.totalVectors()).thenReturn(12);

        QueryResponse response = retrievalService.query("question", 2);

        assertThat(response.results()).containsExactly(hit);
        assertThat(response.totalVectors()).isEqualTo(12);
        assertThat(response.queryTimeMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void getDocumentNames_delegatesToStore() {
        when(retrievalStore.documentNames()).thenReturn(List.of("a.md", "b.md"));

        assertThat(retrievalService.getDocumentNames()).containsExactly("a.md", "b.md");
    }
}
