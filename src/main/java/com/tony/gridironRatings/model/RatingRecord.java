package com.tony.gridironRatings.model;

import lombok.Value;

/**
 * Ligne immuable du ledger : la note d'une entité après un match ou après un rappel vers la base.
 * {@code position} n'est renseignée que pour les joueurs.
 */
@Value
public class RatingRecord {
    int season;
    int week;
    String entityId;
    EntityType entityType;
    Position position;
    double rating;
    RatingEvent event;

    public static RatingRecord team(int season, int week, String teamId, double rating) {
        return new RatingRecord(season, week, teamId, EntityType.TEAM, null, rating, RatingEvent.GAME);
    }

    public static RatingRecord player(int season, int week, String playerId, Position position, double rating) {
        return new RatingRecord(season, week, playerId, EntityType.PLAYER, position, rating, RatingEvent.GAME);
    }

    public static RatingRecord teamReversion(int season, int week, String teamId, double rating) {
        return new RatingRecord(season, week, teamId, EntityType.TEAM, null, rating, RatingEvent.REVERSION);
    }

    public static RatingRecord playerReversion(int season, int week, String playerId, Position position, double rating) {
        return new RatingRecord(season, week, playerId, EntityType.PLAYER, position, rating, RatingEvent.REVERSION);
    }

    public SeasonWeek seasonWeek() {
        return new SeasonWeek(season, week);
    }

    public boolean isGame() {
        return event == RatingEvent.GAME;
    }
}
