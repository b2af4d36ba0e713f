package com.techtrends.news.trend;

public record KeywordCount(String keyword, int frequency) {}
