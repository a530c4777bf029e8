package com.adlanda.channelknowledge.model;

/**
 * Kind of media attached to a channel post, classified at the source boundary.
 */
public enum MediaType {
    PHOTO,
    VOICE,
    VIDEO_NOTE,
    VIDEO,
    DOCUMENT,
    OTHER
}
