package com.williamcallahan.ratchet;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.ratchet.jobs.JobRunner;
import com.williamcallahan.ratchet.jobs.JobWorker;
import com.williamcallahan.ratchet.service.classification.IncidentClassifier;
import com.williamcallahan.ratchet.service.classification.MessageJsonIncidentClassifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:ratchet;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.sql.init.platform=h2",
        "ratchet.jobs.enabled=false",
        "ratchet.classifier.mode=message-json",
        "ratchet.embedding.api-key=test"
})
class RatchetApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
    }

    @Test
    void workersAreRegisteredWithoutStartingRunner() {
        assertTrue(context.getBeansOfType(JobWorker.class).size() >= 5);
        assertTrue(context.getBeansOfType(JobRunner.class).isEmpty());
        assertInstanceOf(MessageJsonIncidentClassifier.class, context.getBean(IncidentClassifier.class));
    }
}
