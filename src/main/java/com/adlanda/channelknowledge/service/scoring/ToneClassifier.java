package com.adlanda.channelknowledge.service.scoring;

import com.adlanda.channelknowledge.model.Tone;

/**
 * Assigns a tone to post text.
 */
public interface ToneClassifier {

    Tone classify(String text);
}
