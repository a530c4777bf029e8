package com.adlanda.channelknowledge;

import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.ChannelRecordService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after KnowledgeBaseRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final VectorIndex vectorIndex;
    private final ChannelRecordService channelService;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(VectorIndex vectorIndex, ChannelRecordService channelService) {
        this.vectorIndex = vectorIndex;
        this.channelService = channelService;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Channel Knowledge Pipeline v{}
            Index: {} entries
            Channels: {} active

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/query
              GET  http://localhost:{}/api/v1/sources

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, vectorIndex.size(), channelService.activeCount(), port, port, port, port
        );
    }
}
