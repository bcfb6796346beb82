package com.williamcallahan.ratchet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.service.classification.IncidentClassifier;
import com.williamcallahan.ratchet.service.classification.MessageJsonIncidentClassifier;
import com.williamcallahan.ratchet.service.classification.SubprocessIncidentClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the incident classifier from {@code ratchet.classifier.mode}.
 */
@Configuration
public class ClassifierConfig {
    private static final Logger log = LoggerFactory.getLogger(ClassifierConfig.class);

    @Bean
    @ConditionalOnProperty(name = "ratchet.classifier.mode", havingValue = "subprocess", matchIfMissing = true)
    public IncidentClassifier subprocessIncidentClassifier(AppProperties appProperties, ObjectMapper objectMapper) {
        AppProperties.Classifier classifier = appProperties.getClassifier();
        return new SubprocessIncidentClassifier(classifier.getBinary(), classifier.getTimeout(), objectMapper);
    }

    /**
     * Development classifier that treats a message whose text is a verdict document as that verdict.
     */
    @Bean
    @ConditionalOnProperty(name = "ratchet.classifier.mode", havingValue = "message-json")
    public IncidentClassifier messageJsonIncidentClassifier(ObjectMapper objectMapper) {
        log.warn("[CLASSIFY] Using the message-json development classifier");
        return new MessageJsonIncidentClassifier(objectMapper);
    }
}
