package com.clipflow.publisher.model.metrics;

public record ReactionBreakdown(long like, long love, long haha, long wow, long sad, long angry) {

    public static final ReactionBreakdown NONE = new ReactionBreakdown(0, 0, 0, 0, 0, 0);

    public long total() {
        return like + love + haha + wow + sad + angry;
    }
}
