package com.adlanda.channelknowledge.config;

import com.adlanda.channelknowledge.config.PipelineProperties.ChannelSeed;
import com.adlanda.channelknowledge.service.ChannelRecordService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Registers the channels listed under {@code pipeline.channels} on startup.
 * Channels that already exist are left untouched, so their watermarks survive restarts.
 */
@Component
@Order(0)
public class ChannelSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ChannelSeeder.class);

    private final ChannelRecordService channelService;
    private final PipelineProperties properties;

    public ChannelSeeder(ChannelRecordService channelService, PipelineProperties properties) {
        this.channelService = channelService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getChannels().isEmpty()) {
            log.info("No channels configured under pipeline.channels");
            return;
        }

        int created = 0;
        int skipped = 0;
        for (ChannelSeed seed : properties.getChannels()) {
            if (channelService.register(seed)) {
                created++;
            } else {
                skipped++;
            }
        }
        log.info("Channel seeding complete: {} registered, {} already present", created, skipped);
    }
}
