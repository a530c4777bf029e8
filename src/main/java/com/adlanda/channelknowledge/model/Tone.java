package com.adlanda.channelknowledge.model;

public enum Tone {
    MOTIVATIONAL,
    PROMOTIONAL,
    INFORMATIONAL,
    CONVERSATIONAL
}
