package com.clipflow.publisher.dto;

import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.Post;
import com.clipflow.publisher.model.metrics.BaseMetrics;

import java.time.LocalDateTime;

public record TopPost(Long postId, Long videoId, Platform platform, String caption, String postUrl,
                      BaseMetrics metrics, LocalDateTime postedAt) {

    public static TopPost from(Post post) {
        return new TopPost(post.getId(), post.getVideoId(), post.getPlatform(), post.getCaption(),
                post.getPostUrl(), post.getMetrics(), post.getPublishedAt());
    }
}
