package com.tony.gridironRatings.service;

import com.tony.gridironRatings.config.RatingProperties;
import com.tony.gridironRatings.ledger.HistoryReplay;
import com.tony.gridironRatings.ledger.RatingLedger;
import com.tony.gridironRatings.model.PlayerInfo;
import com.tony.gridironRatings.model.Position;
import com.tony.gridironRatings.model.RatingRecord;
import com.tony.gridironRatings.model.RosterSlot;
import com.tony.gridironRatings.model.SeasonWeek;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Elo par joueur : K propre au poste, espérance calculée contre la force de l'unité adverse
 * (pas contre un joueur adverse), rappel des inactifs, et projection d'un effectif en ajustement d'équipe.
 * <p>
 * Mise à jour unilatérale : contrairement aux équipes, rien n'est à somme nulle ici.
 */
@Service
@Slf4j
public class PlayerEloService {

    private final RatingProperties.Player config;

    private final Map<String, Double> ratings = new HashMap<>();
    private final Map<String, PlayerInfo> playerInfo = new HashMap<>();
    private final RatingLedger ledger = new RatingLedger();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public PlayerEloService(RatingProperties properties) {
        this.config = properties.getPlayer();
    }

    public double getBaseRating() {
        return config.getInitialRating();
    }

    /**
     * Crée le joueur à la note de base s'il est inconnu. Le poste est figé à la première observation.
     */
    public void initializePlayer(String playerId, Position position) {
        lock.writeLock().lock();
        try {
            initializeIfAbsent(playerId, position);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public double getRating(String playerId) {
        lock.readLock().lock();
        try {
            return ratings.getOrDefault(playerId, config.getInitialRating());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<PlayerInfo> playerInfo(String playerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(playerInfo.get(playerId)).map(PlayerInfo::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Met à jour la note d'un joueur après un match.
     *
     * @param opponentStrength force de l'unité adverse, sur l'échelle joueur
     * @param performanceScore performance 0-1 (0.5 = conforme à l'attendu)
     * @param snapShare        part des snaps jouées (0-1), réduit le K
     * @return la nouvelle note
     */
    public double update(String playerId, double opponentStrength, double performanceScore, double snapShare,
                         int season, int week) {
        lock.writeLock().lock();
        try {
            PlayerInfo info = initializeIfAbsent(playerId, Position.UNKNOWN);
            double current = ratings.get(playerId);

            double k = config.kFactorFor(info.getPosition()) * snapShare;
            double expected = EloFormula.expectedScore(current, opponentStrength);
            double updated = current + k * (performanceScore - expected);

            ratings.put(playerId, updated);
            info.setGames(info.getGames() + 1);
            info.setLastUpdateWeek(new SeasonWeek(season, week));
            ledger.append(RatingRecord.player(season, week, playerId, info.getPosition(), updated));

            log.debug("Elo joueur {} ({}) : {} -> {}", playerId, info.getPosition(), current, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rappel vers la base des joueurs sans mise à jour depuis au moins N semaines (blessés, remplaçants...).
     * Un joueur jamais mis à jour n'est pas touché. Chaque rappel est inscrit au ledger en (saison, semaine) courantes.
     *
     * @return nombre de joueurs rappelés
     */
    public int regressInactive(int currentSeason, int currentWeek) {
        lock.writeLock().lock();
        try {
            SeasonWeek now = new SeasonWeek(currentSeason, currentWeek);
            int regressed = 0;
            for (Map.Entry<String, PlayerInfo> entry : playerInfo.entrySet()) {
                SeasonWeek last = entry.getValue().getLastUpdateWeek();
                if (last == null) continue;

                if (now.weeksSince(last, config.getWeeksPerSeason()) >= config.getInactivityThresholdWeeks()) {
                    String playerId = entry.getKey();
                    double reverted = EloFormula.revertTowards(ratings.get(playerId), config.getInitialRating(), config.getReversionFactor());
                    ratings.put(playerId, reverted);
                    ledger.append(RatingRecord.playerReversion(currentSeason, currentWeek, playerId, entry.getValue().getPosition(), reverted));
                    regressed++;
                }
            }
            log.info("💤 {} joueurs inactifs rappelés vers {} (saison {}, semaine {})",
                    regressed, config.getInitialRating(), currentSeason, currentWeek);
            return regressed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Projette les notes d'un effectif en un ajustement scalaire de la note Elo d'équipe.
     * Par poste : somme des notes pondérées par les snaps, moins (effectif du poste × base), fois le poids du poste.
     * Le total est mis à l'échelle puis borné pour qu'aucun effectif ne domine la prédiction.
     */
    public double teamAdjustment(Collection<RosterSlot> roster) {
        lock.readLock().lock();
        try {
            double base = config.getInitialRating();
            double total = 0.0;

            for (Map.Entry<Position, Double> weight : config.getPositionWeights().entrySet()) {
                List<RosterSlot> atPosition = roster.stream()
                        .filter(slot -> slot.position() == weight.getKey())
                        .toList();
                if (atPosition.isEmpty()) continue;

                double weightedRatings = 0.0;
                for (RosterSlot slot : atPosition) {
                    weightedRatings += ratings.getOrDefault(slot.playerId(), base) * slot.snapShare();
                }
                double positionDelta = weightedRatings - atPosition.size() * base;
                total += positionDelta * weight.getValue();
            }

            double max = config.getMaxAdjustment();
            return Math.max(-max, Math.min(max, total * config.getAdjustmentScale()));
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

    public Map<String, PlayerInfo> playerInfoSnapshot() {
        lock.readLock().lock();
        try {
            Map<String, PlayerInfo> copy = new HashMap<>();
            playerInfo.forEach((id, info) -> copy.put(id, info.copy()));
            return copy;
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

    public List<RatingRecord> history(String playerId) {
        lock.readLock().lock();
        try {
            return ledger.historyOf(playerId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reconstruit notes et métadonnées depuis l'historique.
     * La note vient de la dernière ligne (rappels compris) ; nombre de matchs et dernière semaine jouée
     * ne tiennent compte que des lignes de match, comme en fonctionnement continu.
     */
    public void restore(List<RatingRecord> records) {
        lock.writeLock().lock();
        try {
            Map<String, RatingRecord> latest = HistoryReplay.rehydrate(ledger, records);
            Map<String, RatingRecord> lastGames = HistoryReplay.latestPerEntity(records, RatingRecord::isGame);
            Map<String, Integer> games = HistoryReplay.gameCounts(records);

            ratings.clear();
            playerInfo.clear();
            latest.forEach((playerId, record) -> {
                ratings.put(playerId, record.getRating());
                Position position = record.getPosition() != null ? record.getPosition() : Position.UNKNOWN;
                RatingRecord lastGame = lastGames.get(playerId);
                SeasonWeek lastUpdate = lastGame != null ? lastGame.seasonWeek() : null;
                playerInfo.put(playerId, new PlayerInfo(position, games.getOrDefault(playerId, 0), lastUpdate));
            });
            log.info("📂 {} joueurs restaurés depuis {} enregistrements", ratings.size(), records.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Appelé sous verrou d'écriture
    private PlayerInfo initializeIfAbsent(String playerId, Position position) {
        PlayerInfo existing = playerInfo.get(playerId);
        if (existing != null) return existing;

        Position resolved = position != null ? position : Position.UNKNOWN;
        PlayerInfo created = PlayerInfo.fresh(resolved);
        playerInfo.put(playerId, created);
        ratings.putIfAbsent(playerId, config.getInitialRating());
        return created;
    }
}
