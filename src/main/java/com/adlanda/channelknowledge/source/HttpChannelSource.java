package com.adlanda.channelknowledge.source;

import com.adlanda.channelknowledge.exception.PermanentFetchException;
import com.adlanda.channelknowledge.exception.TransientFetchException;
import com.adlanda.channelknowledge.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Arrays;
import java.util.List;

/**
 * Channel source backed by an HTTP bridge to the messaging platform.
 *
 * Calls {@code GET /channels/{channelId}/messages?after={watermark}&limit={limit}}.
 * 404 and 403 mean the channel is gone or private; other client errors, except
 * 408 and 429, are treated the same way. Server errors and I/O failures are transient.
 */
public class HttpChannelSource implements ChannelSource {

    private static final Logger log = LoggerFactory.getLogger(HttpChannelSource.class);

    private final RestClient restClient;

    public HttpChannelSource(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<ContentItem> fetch(long channelId, Long sinceMessageId, int limit) {
        ChannelMessagePayload[] payload;
        try {
            payload = restClient.get()
                    .uri(uri -> {
                        uri.path("/channels/{channelId}/messages").queryParam("limit", limit);
                        if (sinceMessageId != null) {
                            uri.queryParam("after", sinceMessageId);
                        }
                        return uri.build(channelId);
                    })
                    .retrieve()
                    .body(ChannelMessagePayload[].class);
        } catch (RestClientResponseException e) {
            throw classify(channelId, e);
        } catch (ResourceAccessException e) {
            throw new TransientFetchException(channelId, "Channel bridge unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransientFetchException(channelId, "Unreadable channel bridge response: " + e.getMessage(), e);
        }

        if (payload == null) {
            return List.of();
        }
        log.debug("Bridge returned {} messages for channel {}", payload.length, channelId);
        return Arrays.stream(payload)
                .map(message -> message.toContentItem(channelId))
                .toList();
    }

    private static RuntimeException classify(long channelId, RestClientResponseException e) {
        HttpStatusCode status = e.getStatusCode();
        String message = "Channel bridge answered " + status.value() + " for channel " + channelId;
        if (status.is4xxClientError()
                && status.value() != HttpStatus.TOO_MANY_REQUESTS.value()
                && status.value() != HttpStatus.REQUEST_TIMEOUT.value()) {
            return new PermanentFetchException(channelId, message, e);
        }
        return new TransientFetchException(channelId, message, e);
    }
}
