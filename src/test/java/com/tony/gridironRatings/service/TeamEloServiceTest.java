package com.tony.gridironRatings.service;

import com.tony.gridironRatings.config.RatingProperties;
import com.tony.gridironRatings.model.GameOutcome;
import com.tony.gridironRatings.model.MatchupProbability;
import com.tony.gridironRatings.model.RatingEvent;
import com.tony.gridironRatings.model.RatingRecord;
import com.tony.gridironRatings.model.TeamRatingUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TeamEloServiceTest {

    private TeamEloService teamElo;

    @BeforeEach
    void setUp() {
        teamElo = new TeamEloService(new RatingProperties());
    }

    @Test
    @DisplayName("Victoire 27-24 à domicile entre deux équipes à 1500")
    void homeWinBetweenEqualTeams() {
        teamElo.initialize(List.of("KC", "BUF"));

        TeamRatingUpdate update = teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);

        // E = 1 / (1 + 10^(-50/400)), M = ln(4)
        assertThat(update.homeDelta()).isCloseTo(11.8816, within(1e-3));
        assertThat(update.homeNew()).isCloseTo(1511.88, within(0.01));
        assertThat(update.awayNew()).isCloseTo(1488.12, within(0.01));
        assertThat(teamElo.getRating("KC")).isEqualTo(update.homeNew());
        assertThat(teamElo.getRating("BUF")).isEqualTo(update.awayNew());
    }

    @Test
    @DisplayName("Somme nulle exacte, y compris sur une défaite à domicile avec gros écart")
    void deltasAreExactlyZeroSum() {
        teamElo.update("SF", "BAL", 31, 17, 2024, 1, false);
        teamElo.update("DET", "MIA", 10, 45, 2024, 1, false);
        TeamRatingUpdate upset = teamElo.update("SF", "DET", 3, 38, 2024, 2, true);

        assertThat(upset.homeDelta() + upset.awayDelta() == 0.0).isTrue();
        assertThat(upset.homeDelta()).isNegative();
        assertThat(upset.awayDelta()).isPositive();
    }

    @Test
    @DisplayName("Match nul : aucune variation, quel que soit le K")
    void tieLeavesRatingsUnchanged() {
        teamElo.update("KC", "BUF", 30, 20, 2024, 1, false);
        double kc = teamElo.getRating("KC");
        double phi = teamElo.getRating("PHI");

        TeamRatingUpdate tie = teamElo.update("KC", "PHI", 20, 20, 2024, 2, true);

        assertThat(tie.homeDelta() == 0.0).isTrue();
        assertThat(tie.awayDelta() == 0.0).isTrue();
        assertThat(teamElo.getRating("KC")).isEqualTo(kc);
        assertThat(teamElo.getRating("PHI")).isEqualTo(phi);
    }

    @Test
    @DisplayName("Les playoffs pèsent 1.2 fois plus")
    void playoffGamesWeighMore() {
        TeamRatingUpdate regular = teamElo.update("A", "B", 27, 24, 2024, 1, false);
        TeamEloService other = new TeamEloService(new RatingProperties());
        TeamRatingUpdate playoff = other.update("A", "B", 27, 24, 2024, 19, true);

        assertThat(playoff.homeDelta()).isCloseTo(regular.homeDelta() * 1.2, within(1e-9));
    }

    @Test
    @DisplayName("Un match sans score est ignoré : ni note, ni historique")
    void gameWithoutScoreIsSkipped() {
        GameOutcome unplayed = GameOutcome.builder()
                .homeTeam("KC").awayTeam("BUF").homeScore(null).awayScore(24).season(2024).week(3).build();

        Optional<TeamRatingUpdate> result = teamElo.update(unplayed);

        assertThat(result).isEmpty();
        assertThat(teamElo.ledgerSnapshot()).isEmpty();
        assertThat(teamElo.getRating("KC")).isEqualTo(1500.0);
    }

    @Test
    @DisplayName("Chaque mise à jour ajoute deux lignes au ledger")
    void updateAppendsTwoRecords() {
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);

        List<RatingRecord> ledger = teamElo.ledgerSnapshot();
        assertThat(ledger).hasSize(2);
        assertThat(ledger).extracting(RatingRecord::getEntityId).containsExactly("KC", "BUF");
        assertThat(ledger).allMatch(r -> r.getSeason() == 2024 && r.getWeek() == 1);
    }

    @Test
    @DisplayName("Initialisation idempotente : ne réécrit jamais une note existante")
    void initializeIsIdempotent() {
        teamElo.initialize(List.of("KC", "BUF"));
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);
        double kc = teamElo.getRating("KC");

        teamElo.initialize(List.of("KC", "BUF", "SF"));
        teamElo.initialize(List.of("KC"));

        assertThat(teamElo.getRating("KC")).isEqualTo(kc);
        assertThat(teamElo.getRating("SF")).isEqualTo(1500.0);
    }

    @Test
    @DisplayName("Équipe inconnue : note de base, sans erreur")
    void unknownTeamDefaultsToBase() {
        assertThat(teamElo.getRating("XXX")).isEqualTo(1500.0);
        assertThat(teamElo.ratingsSnapshot()).isEmpty();
    }

    @Test
    @DisplayName("Rappel à la moyenne : chaque note finit entre sa valeur et la base")
    void regressToMeanPullsTowardsBase() {
        teamElo.initialize(List.of("KC", "BUF", "NYJ"));
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);
        Map<String, Double> before = teamElo.ratingsSnapshot();

        teamElo.regressToMean(2025);

        assertThat(teamElo.getRating("KC")).isCloseTo(before.get("KC") * 0.67 + 1500 * 0.33, within(1e-9));
        assertThat(teamElo.getRating("KC")).isStrictlyBetween(1500.0, before.get("KC"));
        assertThat(teamElo.getRating("BUF")).isStrictlyBetween(before.get("BUF"), 1500.0);
        assertThat(teamElo.getRating("NYJ")).isEqualTo(1500.0);
    }

    @Test
    @DisplayName("Rappel à la moyenne inscrit au ledger en semaine 0 de la nouvelle saison")
    void regressToMeanIsRecordedInLedger() {
        teamElo.initialize(List.of("NYJ"));
        teamElo.update("KC", "BUF", 27, 24, 2024, 18, false);

        teamElo.regressToMean(2025);

        List<RatingRecord> reversions = teamElo.ledgerSnapshot().stream()
                .filter(r -> r.getEvent() == RatingEvent.REVERSION)
                .toList();
        assertThat(reversions).extracting(RatingRecord::getEntityId).containsExactlyInAnyOrder("KC", "BUF", "NYJ");
        assertThat(reversions).allMatch(r -> r.getSeason() == 2025 && r.getWeek() == 0);
        assertThat(teamElo.history("KC")).last().extracting(RatingRecord::getRating).isEqualTo(teamElo.getRating("KC"));
    }

    @Test
    @DisplayName("Équipes connues : initialisées ou vues en match")
    void knownTeamsListsEveryTeamSeen() {
        teamElo.initialize(List.of("NYJ"));
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);

        assertThat(teamElo.knownTeams()).containsExactlyInAnyOrder("NYJ", "KC", "BUF");
    }

    @Test
    @DisplayName("Terrain neutre : probabilités complémentaires et symétriques")
    void neutralSiteIsSymmetric() {
        teamElo.update("SF", "BAL", 31, 17, 2024, 1, false);

        MatchupProbability ab = teamElo.matchupProbability("SF", "BAL", true);
        MatchupProbability ba = teamElo.matchupProbability("BAL", "SF", true);

        assertThat(ab.homeWinProbability() + ab.awayWinProbability()).isCloseTo(1.0, within(1e-12));
        assertThat(ab.homeWinProbability()).isCloseTo(1.0 - ba.homeWinProbability(), within(1e-12));
    }

    @Test
    @DisplayName("L'avantage du terrain favorise le domicile à notes égales")
    void homeAdvantageFavorsHomeTeam() {
        MatchupProbability home = teamElo.matchupProbability("KC", "BUF", false);
        MatchupProbability neutral = teamElo.matchupProbability("KC", "BUF", true);

        assertThat(home.homeWinProbability()).isCloseTo(0.5715, within(1e-4));
        assertThat(neutral.homeWinProbability()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Restauration : mêmes notes, au bit près, qu'un process jamais redémarré, rappel compris")
    void restoreReproducesLiveRatings() {
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);
        teamElo.update("SF", "KC", 17, 31, 2024, 2, false);
        teamElo.update("BUF", "SF", 24, 24, 2024, 3, false);
        teamElo.regressToMean(2025);
        teamElo.update("SF", "BUF", 20, 13, 2025, 1, false);
        Map<String, Double> live = teamElo.ratingsSnapshot();

        TeamEloService restored = new TeamEloService(new RatingProperties());
        restored.restore(teamElo.ledgerSnapshot());

        live.forEach((team, rating) -> assertThat(restored.getRating(team)).isEqualTo(rating));
        assertThat(restored.history("KC")).hasSize(3);
    }
}
