package com.tony.gridironRatings.model;

/**
 * Postes suivis par le modèle joueur.
 * K et P existent dans les feuilles de match mais ne pèsent pas dans l'ajustement d'équipe.
 */
public enum Position {
    QB, RB, WR, TE, OL, DL, LB, CB, S, K, P, UNKNOWN;

    // Tolérant : une valeur inconnue (ou vide) du flux tombe sur UNKNOWN
    public static Position fromCode(String code) {
        if (code == null || code.isBlank()) return UNKNOWN;
        try {
            return Position.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
