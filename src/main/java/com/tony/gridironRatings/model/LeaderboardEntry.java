package com.tony.gridironRatings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@AllArgsConstructor
@Builder
public class LeaderboardEntry {
    private int rank;
    private String entityId;
    private Position position; // joueurs uniquement
    private Integer games;     // joueurs uniquement
    private double rating;
}
