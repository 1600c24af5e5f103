package com.tony.gridironRatings.model;

/**
 * Avant/après d'une mise à jour Elo entre deux équipes. awayDelta vaut exactement -homeDelta.
 */
public record TeamRatingUpdate(
        String homeTeam,
        String awayTeam,
        double homeOld,
        double awayOld,
        double homeNew,
        double awayNew,
        double homeDelta,
        double awayDelta) {
}
