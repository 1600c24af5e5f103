package com.tony.gridironRatings.model;

public record MatchupProbability(String homeTeam, String awayTeam, double homeWinProbability, double awayWinProbability) {
}
