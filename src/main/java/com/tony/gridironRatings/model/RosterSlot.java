package com.tony.gridironRatings.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Joueur aligné pour un match à venir (sans score de performance).
 */
public record RosterSlot(
        @NotBlank String playerId,
        @NotNull Position position,
        @DecimalMin("0.0") @DecimalMax("1.0") double snapShare) {
}
