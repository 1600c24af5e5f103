package com.tony.gridironRatings.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineReport {
    private int gamesProcessed;
    private int gamesSkipped;
    private int playerUpdates;
    private int seasonTransitions;

    @Override
    public String toString() {
        return String.format("%d matchs traités, %d ignorés (score absent), %d mises à jour joueurs, %d changements de saison",
                gamesProcessed, gamesSkipped, playerUpdates, seasonTransitions);
    }
}
