package com.adlanda.channelknowledge;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.health.PipelineHealthIndicator;
import com.adlanda.channelknowledge.service.KnowledgeBaseLoader;
import com.adlanda.channelknowledge.service.KnowledgeBaseLoader.LoadSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Loads the curated knowledge base on application startup.
 */
@Component
@Order(1) // Run after ChannelSeeder, before StartupInfoLogger
public class KnowledgeBaseRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseRunner.class);

    private final KnowledgeBaseLoader loader;
    private final PipelineHealthIndicator healthIndicator;
    private final PipelineProperties properties;

    public KnowledgeBaseRunner(KnowledgeBaseLoader loader,
                               PipelineHealthIndicator healthIndicator,
                               PipelineProperties properties) {
        this.loader = loader;
        this.healthIndicator = healthIndicator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getKnowledgeBase().isEnabled()) {
            log.info("Knowledge base loading disabled");
            return;
        }

        log.info("Loading knowledge base from {}", properties.getKnowledgeBase().getPath());
        try {
            LoadSummary summary = loader.loadAll();
            healthIndicator.recordKnowledgeBaseLoad(summary);
        } catch (RuntimeException e) {
            log.error("Failed to load knowledge base: {}", e.getMessage(), e);
            healthIndicator.recordKnowledgeBaseFailure(e.getMessage());
        }
    }
}
