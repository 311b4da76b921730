package com.clipflow.publisher.dto;

import com.clipflow.publisher.model.Post;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Ordering used to pick a platform's top posts. Ties are broken by post id so the selection is
 * stable across calls.
 */
public enum TopPostRanking {
    ENGAGEMENT(Comparator.comparingLong(Post::getEngagement).reversed()),
    RECENCY(Comparator.comparing(Post::getPublishedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));

    private final Comparator<Post> order;

    TopPostRanking(Comparator<Post> order) {
        this.order = order;
    }

    public Comparator<Post> comparator() {
        return order.thenComparing(Post::getId, Comparator.nullsLast(Comparator.<Long>naturalOrder()));
    }
}
