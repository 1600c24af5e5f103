package com.tony.gridironRatings.model;

public record RatingSummary(EntityType entityType, long count, double mean, double standardDeviation, double min, double max) {

    public static RatingSummary empty(EntityType type) {
        return new RatingSummary(type, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }
}
