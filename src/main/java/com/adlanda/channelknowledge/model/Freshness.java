package com.adlanda.channelknowledge.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Human-readable age descriptors for retrieved snippets.
 */
public final class Freshness {

    private Freshness() {
    }

    public static String describe(LocalDate updated, boolean expired, LocalDate today) {
        if (expired) {
            return "expired";
        }
        if (updated == null) {
            return "date unknown";
        }
        long days = Math.max(0, ChronoUnit.DAYS.between(updated, today));
        if (days == 0) {
            return "today";
        }
        if (days == 1) {
            return "yesterday";
        }
        if (days < 7) {
            return days + " days ago";
        }
        if (days < 30) {
            return plural(days / 7, "week");
        }
        if (days < 365) {
            return plural(days / 30, "month");
        }
        return plural(days / 365, "year");
    }

    private static String plural(long amount, String unit) {
        return amount + " " + unit + (amount == 1 ? "" : "s") + " ago";
    }
}
