package io.relaywatch.queue;

public final class JobKinds {
    public static final String POPULATE = "populate";
    public static final String CHECK_SINGLE = "checkSingle";
    public static final String TRAWL_BATCH_PREFIX = "trawlBatch";

    private JobKinds() {
    }

    public static String trawlBatch(int index) {
        return TRAWL_BATCH_PREFIX + index;
    }

    public static String checkSingleDedupKey(String relayId) {
        return CHECK_SINGLE + ":" + relayId;
    }
}
