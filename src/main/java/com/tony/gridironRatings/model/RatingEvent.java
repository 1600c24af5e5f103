package com.tony.gridironRatings.model;

/**
 * Origine d'une ligne du ledger.
 * GAME = note après un match ; REVERSION = rappel vers la base (intersaison ou inactivité).
 */
public enum RatingEvent {
    GAME,
    REVERSION;

    // Les anciens fichiers n'ont pas la colonne : tout y est GAME
    public static RatingEvent fromCode(String code) {
        if (code == null || code.isBlank()) return GAME;
        return RatingEvent.valueOf(code.trim().toUpperCase());
    }
}
