package dev.ppee.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Configures the embedding model, the reranking model and the vector store beans.
 *
 * <p>Query embeddings come from bge-m3 (1024 dimensions) served by Ollama, the same model the
 * indexer used for the stored chunks. The {@link PgVectorEmbeddingStore} reads the
 * {@code document_chunks} table and shares the application's HikariCP {@link DataSource}.
 *
 * @see dev.ppee.search.ChunkRetriever
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the bge-m3 embedding model served by Ollama.
     *
     * @param baseUrl   Ollama server base URL
     * @param modelName embedding model name, must match the indexer's
     * @param timeoutMs request timeout in milliseconds
     * @return an embedding model producing 1024-dimension vectors
     */
    @Bean
    public EmbeddingModel embeddingModel(
            @Value("${ppee.ollama.base-url}") String baseUrl,
            @Value("${ppee.embedding.model-name}") String modelName,
            @Value("${ppee.embedding.timeout-ms:60000}") long timeoutMs) {
        return OllamaEmbeddingModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .timeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    /**
     * Provides the in-process ONNX cross-encoder (bge-reranker-v2-m3) used for reranking.
     *
     * @param modelPath     path to the ONNX model file
     * @param tokenizerPath path to the tokenizer JSON file
     * @return a ready-to-use scoring model
     */
    @Bean
    public ScoringModel scoringModel(
            @Value("${ppee.reranker.model-path}") String modelPath,
            @Value("${ppee.reranker.tokenizer-path}") String tokenizerPath) {
        return new OnnxScoringModel(modelPath, tokenizerPath);
    }

    /**
     * Configures the pgvector embedding store over the indexer's chunk table.
     *
     * <p>Schema and HNSW index are managed by Flyway; {@code createTable} and {@code useIndex}
     * are disabled. Metadata is one JSONB column, which is what the {@code application_id} filter
     * and the native text queries read.
     *
     * @param dataSource the shared HikariCP data source
     * @param dimension  embedding dimension, 1024 for bge-m3
     * @return a vector-search embedding store backed by pgvector
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource,
            @Value("${ppee.embedding.dimension:1024}") int dimension) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table("document_chunks")
                .dimension(dimension)
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)    // HNSW index managed by Flyway V1
                .metadataStorageConfig(DefaultMetadataStorageConfig.builder()
                        .storageMode(MetadataStorageMode.COMBINED_JSONB)
                        .columnDefinitions(List.of("metadata JSONB NULL"))
                        .build())
                .build();
    }
}
