package com.techtrends.news.trend;

/**
 * Aggregate for one category within a window.
 *
 * @param totalEngagement sum of points, comments and reactions
 */
public record CategoryStats(int articleCount, long totalEngagement) {

    CategoryStats add(long engagement) {
        return new CategoryStats(articleCount + 1, totalEngagement + engagement);
    }
}
