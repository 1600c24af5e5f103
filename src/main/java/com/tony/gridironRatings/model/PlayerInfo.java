package com.tony.gridironRatings.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Vue matérialisée sur le ledger joueur (jamais source de vérité, reconstructible par replay).
 */
@Data
@AllArgsConstructor
public class PlayerInfo {
    private Position position;
    private int games;
    private SeasonWeek lastUpdateWeek; // null tant que le joueur n'a pas joué

    public static PlayerInfo fresh(Position position) {
        return new PlayerInfo(position, 0, null);
    }

    public PlayerInfo copy() {
        return new PlayerInfo(position, games, lastUpdateWeek);
    }
}
