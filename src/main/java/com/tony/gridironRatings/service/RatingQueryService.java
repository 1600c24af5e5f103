package com.tony.gridironRatings.service;

import com.tony.gridironRatings.model.EntityType;
import com.tony.gridironRatings.model.LeaderboardEntry;
import com.tony.gridironRatings.model.MatchupProbability;
import com.tony.gridironRatings.model.PlayerInfo;
import com.tony.gridironRatings.model.Position;
import com.tony.gridironRatings.model.RatingRecord;
import com.tony.gridironRatings.model.RatingSummary;
import com.tony.gridironRatings.model.RosterSlot;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Lectures seules pour les consommateurs (features, inférence, API). Aucun effet de bord.
 */
@Service
@RequiredArgsConstructor
public class RatingQueryService {

    private final TeamEloService teamEloService;
    private final PlayerEloService playerEloService;

    public double teamRating(String teamId) {
        return teamEloService.getRating(teamId);
    }

    // Ordre alphabétique, pour un affichage stable
    public List<String> knownTeams() {
        return teamEloService.knownTeams().stream().sorted().toList();
    }

    public double playerRating(String playerId) {
        return playerEloService.getRating(playerId);
    }

    public MatchupProbability matchupProbability(String homeTeam, String awayTeam, boolean neutralSite) {
        return teamEloService.matchupProbability(homeTeam, awayTeam, neutralSite);
    }

    public double teamAdjustment(Collection<RosterSlot> roster) {
        return playerEloService.teamAdjustment(roster);
    }

    /**
     * Probabilité de victoire avec les notes d'équipe corrigées par l'effectif aligné de chaque côté.
     */
    public MatchupProbability adjustedMatchupProbability(String homeTeam, String awayTeam, boolean neutralSite,
                                                         Collection<RosterSlot> homeRoster, Collection<RosterSlot> awayRoster) {
        double home = teamEloService.getRating(homeTeam) + playerEloService.teamAdjustment(homeRoster);
        double away = teamEloService.getRating(awayTeam) + playerEloService.teamAdjustment(awayRoster);
        return teamEloService.probability(homeTeam, awayTeam, home, away, neutralSite);
    }

    public List<LeaderboardEntry> teamLeaderboard(int limit) {
        List<Map.Entry<String, Double>> sorted = teamEloService.ratingsSnapshot().entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(limit)
                .toList();

        List<LeaderboardEntry> board = new ArrayList<>();
        int rank = 1;
        for (Map.Entry<String, Double> e : sorted) {
            board.add(LeaderboardEntry.builder().rank(rank++).entityId(e.getKey()).rating(e.getValue()).build());
        }
        return board;
    }

    /**
     * Classement joueurs, éventuellement filtré par poste (null = tous postes).
     */
    public List<LeaderboardEntry> playerLeaderboard(Position position, int limit) {
        Map<String, Double> ratings = playerEloService.ratingsSnapshot();
        Map<String, PlayerInfo> infos = playerEloService.playerInfoSnapshot();

        List<String> ids = ratings.keySet().stream()
                .filter(id -> position == null || (infos.containsKey(id) && infos.get(id).getPosition() == position))
                .sorted(Comparator.comparing((String id) -> ratings.get(id)).reversed().thenComparing(Comparator.naturalOrder()))
                .limit(limit)
                .toList();

        List<LeaderboardEntry> board = new ArrayList<>();
        int rank = 1;
        for (String id : ids) {
            PlayerInfo info = infos.get(id);
            board.add(LeaderboardEntry.builder()
                    .rank(rank++)
                    .entityId(id)
                    .position(info != null ? info.getPosition() : Position.UNKNOWN)
                    .games(info != null ? info.getGames() : 0)
                    .rating(ratings.get(id))
                    .build());
        }
        return board;
    }

    public List<RatingRecord> teamTrajectory(String teamId) {
        return teamEloService.history(teamId);
    }

    public List<RatingRecord> playerTrajectory(String playerId) {
        return playerEloService.history(playerId);
    }

    /**
     * Distribution des notes courantes d'un store (moyenne, écart-type, bornes).
     */
    public RatingSummary summary(EntityType type) {
        Collection<Double> values = type == EntityType.TEAM
                ? teamEloService.ratingsSnapshot().values()
                : playerEloService.ratingsSnapshot().values();
        if (values.isEmpty()) return RatingSummary.empty(type);

        DescriptiveStatistics stats = new DescriptiveStatistics();
        values.forEach(stats::addValue);
        return new RatingSummary(type, stats.getN(), stats.getMean(), stats.getStandardDeviation(), stats.getMin(), stats.getMax());
    }
}
