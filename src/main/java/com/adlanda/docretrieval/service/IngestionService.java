package com.adlanda.docretrieval.service;

import com.adlanda.docretrieval.chunking.TokenChunker;
import com.adlanda.docretrieval.config.RetrievalProperties;
import com.adlanda.docretrieval.model.AddResult;
import com.adlanda.docretrieval.model.ResetResponse;
import com.adlanda.docretrieval.model.ResetResult;
import com.adlanda.docretrieval.model.UploadResponse;
import com.adlanda.docretrieval.repository.RetrievalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Service responsible for turning uploaded documents into indexed chunks.
 *
 * Text extraction from binary formats is not handled here; only plain text
 * and Markdown uploads are accepted.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".txt", ".md", ".markdown");

    private final TokenChunker chunker;
    private final RetrievalStore retrievalStore;
    private final RetrievalProperties properties;

    public IngestionService(TokenChunker chunker, RetrievalStore retrievalStore, RetrievalProperties properties) {
        this.chunker = chunker;
        this.retrievalStore = retrievalStore;
        this.properties = properties;
    }

    /**
     * Ingests an uploaded file.
     *
     * @param filename Original file name, used as the document name
     * @param content  Raw file bytes, decoded as UTF-8
     * @throws IllegalArgumentException for unsupported file types or files without text
     */
    public UploadResponse ingestFile(String filename, byte[] content) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        if (!isSupported(filename)) {
            throw new IllegalArgumentException("Unsupported file type: " + filename
                    + ". Supported types: " + String.join(", ", SUPPORTED_EXTENSIONS.stream().sorted().toList()));
        }
        return ingestText(filename, new String(content, StandardCharsets.UTF_8));
    }

    /**
     * Chunks text and adds the chunks to the store under the given document name.
     */
    public UploadResponse ingestText(String documentName, String text) {
        if (TokenChunker.isBlank(text)) {
            throw new IllegalArgumentException("No text could be extracted from file '" + documentName
                    + "'. It might be empty or corrupted.");
        }
        log.info("Ingesting '{}' ({} characters)", documentName, text.length());

        List<String> chunks = chunkContent(text);
        if (chunks.isEmpty()) {
            return new UploadResponse(documentName,
                    "File processed, but no valid text chunks were generated.",
                    0, retrievalStore.totalVectors());
        }

        AddResult result = retrievalStore.addDocuments(chunks, documentName);
        return new UploadResponse(documentName,
                "File processed and content added to vector store successfully.",
                result.chunksAdded(), result.totalVectors());
    }

    /**
     * Resets the store, dropping every document.
     */
    public ResetResponse resetStore() {
        ResetResult result = retrievalStore.reset();
        return new ResetResponse("Vector store has been successfully reset.", result.totalVectors());
    }

    List<String> chunkContent(String content) {
        List<String> chunks = chunker.chunk(content, properties.getChunkSize(), properties.getChunkOverlap());
        log.debug("Created {} chunks (size {}, overlap {})",
                chunks.size(), properties.getChunkSize(), properties.getChunkOverlap());
        return chunks;
    }

    private boolean isSupported(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }
}
