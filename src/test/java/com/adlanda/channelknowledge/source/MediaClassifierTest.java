package com.adlanda.channelknowledge.source;

import com.adlanda.channelknowledge.model.MediaType;
import com.adlanda.channelknowledge.source.ChannelMessagePayload.MediaPayload;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaClassifierTest {

    @Test
    void classify_noMedia_isNull() {
        assertThat(MediaClassifier.classify(null)).isNull();
        assertThat(MediaClassifier.classify(new MediaPayload(" ", null, false, false))).isNull();
    }

    @Test
    void classify_photo() {
        assertThat(MediaClassifier.classify(new MediaPayload("MessageMediaPhoto", null, false, false)))
                .isEqualTo(MediaType.PHOTO);
    }

    @Test
    void classify_documentsByMimeAndFlags() {
        assertThat(MediaClassifier.classify(new MediaPayload("document", "audio/ogg", false, false)))
                .isEqualTo(MediaType.VOICE);
        assertThat(MediaClassifier.classify(new MediaPayload("document", "video/mp4", false, true)))
                .isEqualTo(MediaType.VIDEO_NOTE);
        assertThat(MediaClassifier.classify(new MediaPayload("document", "video/mp4", false, false)))
                .isEqualTo(MediaType.VIDEO);
        assertThat(MediaClassifier.classify(new MediaPayload("document", "application/pdf", false, false)))
                .isEqualTo(MediaType.DOCUMENT);
    }

    @Test
    void classify_plainVideoAndVoiceTypes() {
        assertThat(MediaClassifier.classify(new MediaPayload("video", null, false, true))).isEqualTo(MediaType.VIDEO_NOTE);
        assertThat(MediaClassifier.classify(new MediaPayload("voice", null, false, false))).isEqualTo(MediaType.VOICE);
    }

    @Test
    void classify_unknownType_isOther() {
        assertThat(MediaClassifier.classify(new MediaPayload("poll", null, false, false))).isEqualTo(MediaType.OTHER);
    }
}
