package com.adlanda.channelknowledge.model;

/**
 * Parameters of one vector search.
 *
 * @param vector         query embedding
 * @param topK           maximum number of hits
 * @param category       optional category restriction
 * @param excludeExpired drop entries past their expiry date
 * @param preferRecent   add the freshness bonus before ranking
 * @param maxAgeDays     optional cut on the age of the entry's updated date
 */
public record IndexQuery(
        float[] vector,
        int topK,
        String category,
        boolean excludeExpired,
        boolean preferRecent,
        Integer maxAgeDays
) {

    public IndexQuery {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Query vector must not be empty");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
    }

    public static IndexQuery of(float[] vector, int topK) {
        return new IndexQuery(vector, topK, null, true, true, null);
    }

    public IndexQuery withCategory(String value) {
        return new IndexQuery(vector, topK, value, excludeExpired, preferRecent, maxAgeDays);
    }

    public IndexQuery withMaxAgeDays(Integer days) {
        return new IndexQuery(vector, topK, category, excludeExpired, preferRecent, days);
    }

    public IndexQuery includingExpired() {
        return new IndexQuery(vector, topK, category, false, preferRecent, maxAgeDays);
    }

    public IndexQuery withoutRecencyPreference() {
        return new IndexQuery(vector, topK, category, excludeExpired, false, maxAgeDays);
    }
}
