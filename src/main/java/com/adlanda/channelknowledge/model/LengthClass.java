package com.adlanda.channelknowledge.model;

/**
 * Whether a post's length falls inside the 300-800 character band that scores best.
 */
public enum LengthClass {
    OPTIMAL,
    SUBOPTIMAL;

    public static LengthClass of(int length) {
        return length >= 300 && length <= 800 ? OPTIMAL : SUBOPTIMAL;
    }
}
