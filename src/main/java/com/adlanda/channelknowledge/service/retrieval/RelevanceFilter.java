package com.adlanda.channelknowledge.service.retrieval;

/**
 * Decides whether a retrieved snippet must be withheld from the consumer.
 */
public interface RelevanceFilter {

    boolean isIrrelevant(String content);
}
