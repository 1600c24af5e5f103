package com.tony.gridironRatings.config;

import com.tony.gridironRatings.model.Position;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "ratings")
@Data
public class RatingProperties {

    private Team team = new Team();
    private Player player = new Player();
    private History history = new History();

    @Data
    public static class Team {
        private double initialRating = 1500.0;
        private double baseKFactor = 20.0;
        private double homeAdvantage = 50.0;
        // Part de l'écart à la moyenne effacée à chaque intersaison (mouvements d'effectif)
        private double reversionFactor = 0.33;
        private double playoffMultiplier = 1.2;
    }

    @Data
    public static class Player {
        private double initialRating = 1000.0;
        private double defaultKFactor = 20.0;
        private double reversionFactor = 0.25;
        private int inactivityThresholdWeeks = 4;
        private int weeksPerSeason = 18;

        // --- Ajustement d'équipe ---
        private double adjustmentScale = 0.1;
        private double maxAdjustment = 100.0;

        // K de base par poste (les postes "skill" bougent plus vite)
        private Map<Position, Double> positionKFactors = new EnumMap<>(Map.of(
                Position.QB, 32.0, Position.RB, 20.0, Position.WR, 20.0,
                Position.TE, 18.0, Position.OL, 15.0, Position.DL, 15.0,
                Position.LB, 18.0, Position.CB, 20.0, Position.S, 18.0
        ));

        // Poids des postes dans l'ajustement d'équipe (somme = 1.0). Réglés à la main, pas appris.
        private Map<Position, Double> positionWeights = new EnumMap<>(Map.of(
                Position.QB, 0.25, Position.RB, 0.08, Position.WR, 0.12,
                Position.TE, 0.05, Position.OL, 0.15, Position.DL, 0.12,
                Position.LB, 0.10, Position.CB, 0.08, Position.S, 0.05
        ));

        public double kFactorFor(Position position) {
            return positionKFactors.getOrDefault(position, defaultKFactor);
        }
    }

    @Data
    public static class History {
        private String directory = "artifacts/elo";
        private String teamFile = "team_elo_history.csv";
        private String playerFile = "player_elo_history.csv";
        private boolean loadOnStartup = true;
    }
}
