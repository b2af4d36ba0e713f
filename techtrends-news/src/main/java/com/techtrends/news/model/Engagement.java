package com.techtrends.news.model;

/**
 * Engagement counters. A source without a concept (Dev.to points, HN reactions) reports 0.
 */
public record Engagement(
    int points,
    int comments,
    int reactions
) {
    public static final Engagement NONE = new Engagement(0, 0, 0);

    public Engagement {
        points = Math.max(points, 0);
        comments = Math.max(comments, 0);
        reactions = Math.max(reactions, 0);
    }

    public long total() {
        return (long) points + comments + reactions;
    }
}
