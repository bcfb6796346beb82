package com.williamcallahan.ratchet.config;

import com.williamcallahan.ratchet.service.EmbeddingClient;
import com.williamcallahan.ratchet.service.OpenAiCompatibleEmbeddingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding provider configuration.
 *
 * <p>A single OpenAI-compatible provider is configured. Missing credentials fail startup rather than
 * leaving messages without embeddings.</p>
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /**
     * @param appProperties application configuration
     * @return embedding client for the configured endpoint
     * @throws IllegalStateException when the API key or model is missing
     */
    @Bean
    @ConditionalOnMissingBean(EmbeddingClient.class)
    public EmbeddingClient embeddingClient(AppProperties appProperties) {
        AppProperties.Embedding embedding = appProperties.getEmbedding();
        log.info("[EMBEDDING] Using OpenAI-compatible embeddings at {} (model={}, dimensions={})",
                embedding.getBaseUrl(), embedding.getModel(), embedding.getDimensions());
        return OpenAiCompatibleEmbeddingClient.create(
                embedding.getBaseUrl(), embedding.getApiKey(), embedding.getModel(), embedding.getDimensions());
    }
}
