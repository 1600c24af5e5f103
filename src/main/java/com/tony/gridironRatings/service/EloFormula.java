package com.tony.gridironRatings.service;

/**
 * Courbe logistique Elo partagée par les équipes et les joueurs.
 * expectedScore(a, b) + expectedScore(b, a) = 1.
 */
public final class EloFormula {

    private static final double ELO_DIVISOR = 400.0;

    private EloFormula() {
    }

    /**
     * Probabilité que A batte B.
     */
    public static double expectedScore(double ratingA, double ratingB) {
        return 1.0 / (1.0 + Math.pow(10.0, (ratingB - ratingA) / ELO_DIVISOR));
    }

    /**
     * Multiplicateur de marge : ln(|écart| + 1). Nul sur un match nul, sous-linéaire pour amortir les cartons.
     */
    public static double marginOfVictoryMultiplier(int homeScore, int awayScore) {
        return Math.log(Math.abs(homeScore - awayScore) + 1);
    }

    /**
     * Rappel partiel vers la moyenne : R * (1 - f) + base * f.
     */
    public static double revertTowards(double rating, double base, double factor) {
        return rating * (1 - factor) + base * factor;
    }
}
