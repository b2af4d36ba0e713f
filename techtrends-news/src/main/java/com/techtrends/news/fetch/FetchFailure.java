package com.techtrends.news.fetch;

public enum FetchFailure {
    NETWORK,        // Timeout, connection or I/O problem, unexpected HTTP status
    PARSE,          // Payload is not JSON or has the wrong shape
    RATE_LIMITED    // HTTP 429
}
