package com.tony.gridironRatings.model;

/**
 * Instant du calendrier (saison, semaine), ordonné lexicographiquement.
 */
public record SeasonWeek(int season, int week) implements Comparable<SeasonWeek> {

    @Override
    public int compareTo(SeasonWeek other) {
        if (season != other.season) return Integer.compare(season, other.season);
        return Integer.compare(week, other.week);
    }

    /**
     * Semaines écoulées depuis {@code earlier}, en comptant {@code weeksPerSeason} semaines par saison.
     */
    public int weeksSince(SeasonWeek earlier, int weeksPerSeason) {
        return (season - earlier.season) * weeksPerSeason + week - earlier.week;
    }
}
