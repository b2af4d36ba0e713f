package com.techtrends.news.trend;

/**
 * Engagement totals, averages and maxima over the articles of a window.
 */
public record EngagementSummary(
    int articleCount,
    long totalPoints,
    long totalComments,
    long totalReactions,
    double avgPoints,
    double avgComments,
    double avgReactions,
    int maxPoints,
    int maxComments,
    int maxReactions
) {
    public static final EngagementSummary EMPTY = new EngagementSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
}
