package com.tony.gridironRatings.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Résultat final d'un match. Un score null = match non joué (ou donnée absente) : il est ignoré.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameOutcome {
    private String gameId;

    @NotBlank
    private String homeTeam;
    @NotBlank
    private String awayTeam;

    @PositiveOrZero
    private Integer homeScore;
    @PositiveOrZero
    private Integer awayScore;

    @Min(1900)
    private int season;
    @Min(0)
    private int week;

    private boolean playoff;

    public boolean hasFinalScore() {
        return homeScore != null && awayScore != null;
    }
}
