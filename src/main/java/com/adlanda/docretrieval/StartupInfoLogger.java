package com.adlanda.docretrieval;

import com.adlanda.docretrieval.config.RetrievalProperties;
import com.adlanda.docretrieval.repository.RetrievalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final RetrievalStore retrievalStore;
    private final RetrievalProperties properties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(RetrievalStore retrievalStore, RetrievalProperties properties) {
        this.retrievalStore = retrievalStore;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Document Retrieval v{}
            Index: {} vectors ({} dimensions)
            Chunking: {} tokens, {} overlap ({})

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/upload
              POST http://localhost:{}/api/v1/query
              POST http://localhost:{}/api/v1/reset-vector-store
              GET  http://localhost:{}/api/v1/sources

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, retrievalStore.totalVectors(), retrievalStore.dimensions(),
            properties.getChunkSize(), properties.getChunkOverlap(), properties.getTokenizerEncoding(),
            port, port, port, port, port, port
        );
    }
}
