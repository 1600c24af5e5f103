package com.tony.gridironRatings.service;

import com.tony.gridironRatings.config.RatingProperties;
import com.tony.gridironRatings.ledger.HistoryReplay;
import com.tony.gridironRatings.ledger.RatingLedger;
import com.tony.gridironRatings.model.GameOutcome;
import com.tony.gridironRatings.model.MatchupProbability;
import com.tony.gridironRatings.model.RatingRecord;
import com.tony.gridironRatings.model.TeamRatingUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Elo par équipe : avantage du terrain, marge de victoire, bonus playoffs, rappel à la moyenne entre deux saisons.
 * <p>
 * Les matchs doivent arriver dans l'ordre (saison, semaine). Un seul écrivain à la fois ;
 * une lecture ne voit jamais une mise à jour à moitié appliquée.
 */
@Service
@Slf4j
public class TeamEloService {

    private final RatingProperties.Team config;

    private final Map<String, Double> ratings = new HashMap<>();
    private final RatingLedger ledger = new RatingLedger();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public TeamEloService(RatingProperties properties) {
        this.config = properties.getTeam();
    }

    public double getBaseRating() {
        return config.getInitialRating();
    }

    /**
     * Place chaque équipe listée à la note de base si elle n'est pas déjà connue. Idempotent.
     */
    public void initialize(Collection<String> teamIds) {
        lock.writeLock().lock();
        try {
            int created = 0;
            for (String teamId : teamIds) {
                if (ratings.putIfAbsent(teamId, config.getInitialRating()) == null) created++;
            }
            log.info("🏈 {} équipes initialisées à {} ({} déjà connues)", created, config.getInitialRating(), teamIds.size() - created);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public double getRating(String teamId) {
        lock.readLock().lock();
        try {
            return ratings.getOrDefault(teamId, config.getInitialRating());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Met à jour les notes des deux équipes après un match réel.
     * Précondition : scores positifs ou nuls, validés en amont.
     */
    public TeamRatingUpdate update(String homeTeam, String awayTeam, int homeScore, int awayScore,
                                   int season, int week, boolean playoff) {
        lock.writeLock().lock();
        try {
            double homeRating = ratings.getOrDefault(homeTeam, config.getInitialRating());
            double awayRating = ratings.getOrDefault(awayTeam, config.getInitialRating());

            // L'avantage du terrain ne joue que sur l'espérance, jamais sur la note stockée
            double expectedHome = EloFormula.expectedScore(homeRating + config.getHomeAdvantage(), awayRating);

            double actualHome = 0.5;
            if (homeScore > awayScore) actualHome = 1.0;
            else if (homeScore < awayScore) actualHome = 0.0;

            double k = config.getBaseKFactor()
                    * EloFormula.marginOfVictoryMultiplier(homeScore, awayScore)
                    * (playoff ? config.getPlayoffMultiplier() : 1.0);

            // Somme nulle : l'extérieur perd exactement ce que gagne le domicile
            double homeDelta = k * (actualHome - expectedHome);
            double awayDelta = -homeDelta;

            double newHome = homeRating + homeDelta;
            double newAway = awayRating + awayDelta;

            ratings.put(homeTeam, newHome);
            ratings.put(awayTeam, newAway);
            ledger.append(RatingRecord.team(season, week, homeTeam, newHome));
            ledger.append(RatingRecord.team(season, week, awayTeam, newAway));

            log.debug("Elo {}-{} : {} {} -> {}, {} {} -> {}", homeScore, awayScore,
                    homeTeam, homeRating, newHome, awayTeam, awayRating, newAway);

            return new TeamRatingUpdate(homeTeam, awayTeam, homeRating, awayRating, newHome, newAway, homeDelta, awayDelta);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Variante "flux" : un match sans score final est ignoré (aucune note modifiée, rien dans le ledger).
     */
    public Optional<TeamRatingUpdate> update(GameOutcome game) {
        if (!game.hasFinalScore()) {
            log.debug("Match {} vs {} ignoré : score absent", game.getHomeTeam(), game.getAwayTeam());
            return Optional.empty();
        }
        return Optional.of(update(game.getHomeTeam(), game.getAwayTeam(), game.getHomeScore(), game.getAwayScore(),
                game.getSeason(), game.getWeek(), game.isPlayoff()));
    }

    /**
     * Rappel à la moyenne de toutes les équipes, avant le premier match de {@code newSeason}.
     * Chaque note rappelée est inscrite au ledger en (newSeason, 0) pour survivre à un redémarrage.
     * À appeler une seule fois par changement de saison (non vérifié : un double appel se cumule).
     */
    public void regressToMean(int newSeason) {
        lock.writeLock().lock();
        try {
            double base = config.getInitialRating();
            ratings.replaceAll((teamId, rating) -> EloFormula.revertTowards(rating, base, config.getReversionFactor()));
            ratings.forEach((teamId, rating) -> ledger.append(RatingRecord.teamReversion(newSeason, 0, teamId, rating)));
            log.info("🔁 Rappel à la moyenne ({}) appliqué à {} équipes avant la saison {}",
                    config.getReversionFactor(), ratings.size(), newSeason);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public MatchupProbability matchupProbability(String homeTeam, String awayTeam, boolean neutralSite) {
        lock.readLock().lock();
        try {
            double homeRating = ratings.getOrDefault(homeTeam, config.getInitialRating());
            double awayRating = ratings.getOrDefault(awayTeam, config.getInitialRating());
            return probability(homeTeam, awayTeam, homeRating, awayRating, neutralSite);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Même calcul à partir de notes déjà ajustées (ex: ajustement d'effectif).
     */
    public MatchupProbability probability(String homeTeam, String awayTeam, double homeRating, double awayRating, boolean neutralSite) {
        double effectiveHome = neutralSite ? homeRating : homeRating + config.getHomeAdvantage();
        double homeProb = EloFormula.expectedScore(effectiveHome, awayRating);
        return new MatchupProbability(homeTeam, awayTeam, homeProb, 1.0 - homeProb);
    }

    public Set<String> knownTeams() {
        lock.readLock().lock();
        try {
            return Set.copyOf(ratings.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Double> ratingsSnapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(ratings);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RatingRecord> ledgerSnapshot() {
        lock.readLock().lock();
        try {
            return ledger.records();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RatingRecord> history(String teamId) {
        lock.readLock().lock();
        try {
            return ledger.historyOf(teamId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remplace l'état vivant par celui reconstruit depuis un historique persisté.
     * Les notes restaurées sont identiques bit à bit à celles d'un process jamais redémarré.
     */
    public void restore(List<RatingRecord> records) {
        lock.writeLock().lock();
        try {
            Map<String, RatingRecord> latest = HistoryReplay.rehydrate(ledger, records);
            ratings.clear();
            latest.forEach((teamId, record) -> ratings.put(teamId, record.getRating()));
            log.info("📂 {} équipes restaurées depuis {} enregistrements", ratings.size(), records.size());
        } finally {
            lock.writeLock().unlock();
        }
    }
}
