package com.tony.gridironRatings.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Participation d'un joueur à un match, pour une équipe.
 * performanceScore = 0.5 : performance exactement conforme à l'attendu (fourni par l'évaluateur amont).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RosterEntry {
    private String gameId;
    @NotBlank
    private String teamId;
    @NotBlank
    private String playerId;

    private Position position;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double snapShare;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double performanceScore;
}
