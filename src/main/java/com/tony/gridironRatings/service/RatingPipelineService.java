package com.tony.gridironRatings.service;

import com.tony.gridironRatings.model.EntityType;
import com.tony.gridironRatings.model.GameOutcome;
import com.tony.gridironRatings.model.RatingRecord;
import com.tony.gridironRatings.model.RosterEntry;
import com.tony.gridironRatings.model.TeamRatingUpdate;
import com.tony.gridironRatings.model.dto.PipelineReport;
import com.tony.gridironRatings.repository.RatingHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rejoue une série de matchs dans l'ordre chronologique sur les deux stores, puis persiste les historiques.
 * <p>
 * Un seul lot à la fois : les lots successifs doivent eux-mêmes se suivre dans le temps.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RatingPipelineService {

    private static final Comparator<GameOutcome> CHRONOLOGICAL =
            Comparator.comparingInt(GameOutcome::getSeason).thenComparingInt(GameOutcome::getWeek);

    private final TeamEloService teamEloService;
    private final PlayerEloService playerEloService;
    private final RatingHistoryRepository historyRepository;

    // Dernière saison traitée (y compris celle de l'historique restauré)
    private Integer currentSeason;

    public synchronized PipelineReport process(List<GameOutcome> games, List<RosterEntry> rosters) {
        long start = System.currentTimeMillis();
        List<GameOutcome> ordered = new ArrayList<>(games);
        ordered.sort(CHRONOLOGICAL); // tri stable : l'ordre intra-semaine est conservé

        Set<String> teams = new LinkedHashSet<>();
        ordered.forEach(g -> {
            teams.add(g.getHomeTeam());
            teams.add(g.getAwayTeam());
        });
        teamEloService.initialize(teams);

        Map<String, List<RosterEntry>> rostersByGame = rosters.stream()
                .filter(r -> r.getGameId() != null)
                .collect(Collectors.groupingBy(RosterEntry::getGameId));

        PipelineReport report = new PipelineReport();
        for (GameOutcome game : ordered) {
            if (currentSeason != null && game.getSeason() != currentSeason) {
                // Intersaison : une seule fois, avant le premier match de la nouvelle saison
                teamEloService.regressToMean(game.getSeason());
                playerEloService.regressInactive(game.getSeason(), 1);
                report.setSeasonTransitions(report.getSeasonTransitions() + 1);
            }
            currentSeason = game.getSeason();

            // Forces d'avant-match : les joueurs sont jugés contre l'adversaire tel qu'il était au coup d'envoi
            double homeBefore = teamEloService.getRating(game.getHomeTeam());
            double awayBefore = teamEloService.getRating(game.getAwayTeam());

            Optional<TeamRatingUpdate> update = teamEloService.update(game);
            if (update.isEmpty()) {
                report.setGamesSkipped(report.getGamesSkipped() + 1);
                continue;
            }
            report.setGamesProcessed(report.getGamesProcessed() + 1);

            List<RosterEntry> gameRoster = game.getGameId() != null
                    ? rostersByGame.getOrDefault(game.getGameId(), List.of())
                    : List.of();
            for (RosterEntry entry : gameRoster) {
                double opponentTeamRating;
                if (entry.getTeamId().equals(game.getHomeTeam())) opponentTeamRating = awayBefore;
                else if (entry.getTeamId().equals(game.getAwayTeam())) opponentTeamRating = homeBefore;
                else {
                    log.warn("Joueur {} rattaché à {} qui ne joue pas le match {}", entry.getPlayerId(), entry.getTeamId(), game.getGameId());
                    continue;
                }

                playerEloService.initializePlayer(entry.getPlayerId(), entry.getPosition());
                playerEloService.update(entry.getPlayerId(), opponentUnitStrength(opponentTeamRating),
                        entry.getPerformanceScore(), entry.getSnapShare(), game.getSeason(), game.getWeek());
                report.setPlayerUpdates(report.getPlayerUpdates() + 1);
            }
        }

        saveHistory();
        log.info("✅ Lot traité en {} ms : {}", System.currentTimeMillis() - start, report);
        return report;
    }

    /**
     * Persiste les deux historiques. Une erreur disque est journalisée, les notes en mémoire restent valides.
     */
    public void saveHistory() {
        try {
            historyRepository.save(EntityType.TEAM, teamEloService.ledgerSnapshot());
            historyRepository.save(EntityType.PLAYER, playerEloService.ledgerSnapshot());
        } catch (RuntimeException e) {
            log.error("❌ Echec de la sauvegarde des historiques Elo", e);
        }
    }

    /**
     * Recharge les deux stores depuis le disque (démarrage à froid si rien n'est lisible).
     */
    public synchronized void restoreFromDisk() {
        List<RatingRecord> teamHistory = historyRepository.load(EntityType.TEAM);
        List<RatingRecord> playerHistory = historyRepository.load(EntityType.PLAYER);
        teamEloService.restore(teamHistory);
        playerEloService.restore(playerHistory);

        currentSeason = teamHistory.stream()
                .map(RatingRecord::getSeason)
                .max(Integer::compare)
                .orElse(null);
        log.info("🔄 Stores restaurés (dernière saison : {})", currentSeason);
    }

    public synchronized Integer getCurrentSeason() {
        return currentSeason;
    }

    // Note d'équipe ramenée sur l'échelle joueur : même écart à la base
    private double opponentUnitStrength(double opponentTeamRating) {
        return playerEloService.getBaseRating() + (opponentTeamRating - teamEloService.getBaseRating());
    }
}
