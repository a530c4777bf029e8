package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.entity.ChannelRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for monitored channels.
 */
@Repository
public interface ChannelRecordRepository extends JpaRepository<ChannelRecord, UUID> {

    Optional<ChannelRecord> findByChannelId(long channelId);

    List<ChannelRecord> findByChannelIdIn(Collection<Long> channelIds);

    /**
     * Active channels, highest priority first so critical channels are polled early in a tick.
     */
    List<ChannelRecord> findByActiveTrueOrderByPriorityDesc();

    List<ChannelRecord> findByFlaggedTrue();

    long countByActiveTrue();
}
