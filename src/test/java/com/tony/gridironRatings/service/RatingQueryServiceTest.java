package com.tony.gridironRatings.service;

import com.tony.gridironRatings.config.RatingProperties;
import com.tony.gridironRatings.model.EntityType;
import com.tony.gridironRatings.model.LeaderboardEntry;
import com.tony.gridironRatings.model.MatchupProbability;
import com.tony.gridironRatings.model.Position;
import com.tony.gridironRatings.model.RatingSummary;
import com.tony.gridironRatings.model.RosterSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RatingQueryServiceTest {

    private TeamEloService teamElo;
    private PlayerEloService playerElo;
    private RatingQueryService queryService;

    @BeforeEach
    void setUp() {
        RatingProperties properties = new RatingProperties();
        teamElo = new TeamEloService(properties);
        playerElo = new PlayerEloService(properties);
        queryService = new RatingQueryService(teamElo, playerElo);
    }

    @Test
    @DisplayName("Classement équipes : trié par note décroissante, rangs à partir de 1")
    void teamLeaderboardIsSortedByRating() {
        teamElo.update("SF", "BAL", 31, 17, 2024, 1, false);
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);

        List<LeaderboardEntry> board = queryService.teamLeaderboard(3);

        assertThat(board).hasSize(3);
        assertThat(board).extracting(LeaderboardEntry::getEntityId).containsExactly("SF", "KC", "BUF");
        assertThat(board).extracting(LeaderboardEntry::getRank).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Équipes connues triées, y compris celles qui n'ont encore joué aucun match")
    void knownTeamsAreSorted() {
        teamElo.initialize(List.of("NYJ"));
        teamElo.update("SF", "BAL", 31, 17, 2024, 1, false);

        assertThat(queryService.knownTeams()).containsExactly("BAL", "NYJ", "SF");
    }

    @Test
    @DisplayName("Classement joueurs filtré par poste, avec nombre de matchs")
    void playerLeaderboardFiltersByPosition() {
        playerElo.initializePlayer("QB1", Position.QB);
        playerElo.initializePlayer("QB2", Position.QB);
        playerElo.initializePlayer("WR1", Position.WR);
        playerElo.update("QB1", 1000, 0.6, 1.0, 2024, 1);
        playerElo.update("QB2", 1000, 0.9, 1.0, 2024, 1);
        playerElo.update("QB2", 1000, 0.9, 1.0, 2024, 2);
        playerElo.update("WR1", 1000, 1.0, 1.0, 2024, 1);

        List<LeaderboardEntry> qbs = queryService.playerLeaderboard(Position.QB, 10);

        assertThat(qbs).extracting(LeaderboardEntry::getEntityId).containsExactly("QB2", "QB1");
        assertThat(qbs.get(0).getGames()).isEqualTo(2);
        assertThat(qbs.get(0).getPosition()).isEqualTo(Position.QB);
        assertThat(queryService.playerLeaderboard(null, 10)).hasSize(3);
    }

    @Test
    @DisplayName("Probabilité ajustée : un meilleur effectif aligné augmente les chances")
    void adjustedMatchupRewardsStrongerRoster() {
        playerElo.initializePlayer("QB_STAR", Position.QB);
        for (int week = 1; week <= 5; week++) {
            playerElo.update("QB_STAR", 1000, 1.0, 1.0, 2024, week);
        }

        MatchupProbability plain = queryService.matchupProbability("KC", "BUF", true);
        MatchupProbability adjusted = queryService.adjustedMatchupProbability("KC", "BUF", true,
                List.of(new RosterSlot("QB_STAR", Position.QB, 1.0)), List.of());

        assertThat(plain.homeWinProbability()).isEqualTo(0.5);
        assertThat(adjusted.homeWinProbability()).isGreaterThan(0.5);
        assertThat(adjusted.homeWinProbability() + adjusted.awayWinProbability()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Résumé : moyenne à la base pour des équipes à somme nulle")
    void summaryOfZeroSumTeams() {
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);
        teamElo.update("SF", "BAL", 31, 17, 2024, 1, false);

        RatingSummary summary = queryService.summary(EntityType.TEAM);

        assertThat(summary.count()).isEqualTo(4);
        assertThat(summary.mean()).isCloseTo(1500.0, within(1e-9));
        assertThat(summary.max()).isEqualTo(teamElo.getRating("SF"));
        assertThat(summary.standardDeviation()).isPositive();
        assertThat(queryService.summary(EntityType.PLAYER).count()).isZero();
    }

    @Test
    @DisplayName("Trajectoire d'une équipe dans l'ordre des semaines")
    void teamTrajectoryIsChronological() {
        teamElo.update("KC", "BUF", 27, 24, 2024, 1, false);
        teamElo.update("BAL", "KC", 20, 17, 2024, 2, false);

        assertThat(queryService.teamTrajectory("KC")).extracting(r -> r.getWeek()).containsExactly(1, 2);
        assertThat(queryService.teamRating("KC")).isEqualTo(queryService.teamTrajectory("KC").get(1).getRating());
    }
}
