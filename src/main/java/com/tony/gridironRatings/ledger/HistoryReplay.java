package com.tony.gridironRatings.ledger;

import com.tony.gridironRatings.model.RatingRecord;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Reconstruction de l'état courant d'un store à partir de son historique.
 * Commun aux équipes et aux joueurs : les deux restaurations passent par ici.
 */
public final class HistoryReplay {

    private HistoryReplay() {
    }

    /**
     * Dernier enregistrement par entité, au sens du plus grand (saison, semaine).
     * À clé égale, le dernier inséré gagne (rejeu d'un même match, match joué après un rappel de la même semaine).
     */
    public static Map<String, RatingRecord> latestPerEntity(Collection<RatingRecord> records) {
        return latestPerEntity(records, r -> true);
    }

    /**
     * Même règle, restreinte aux enregistrements retenus par {@code filter}.
     */
    public static Map<String, RatingRecord> latestPerEntity(Collection<RatingRecord> records, Predicate<RatingRecord> filter) {
        Map<String, RatingRecord> latest = new LinkedHashMap<>();
        for (RatingRecord record : records) {
            if (!filter.test(record)) continue;
            latest.merge(record.getEntityId(), record,
                    (current, candidate) -> candidate.seasonWeek().compareTo(current.seasonWeek()) >= 0 ? candidate : current);
        }
        return latest;
    }

    /**
     * Nombre de matchs par entité (les lignes de rappel ne comptent pas).
     */
    public static Map<String, Integer> gameCounts(Collection<RatingRecord> records) {
        Map<String, Integer> counts = new HashMap<>();
        for (RatingRecord record : records) {
            if (record.isGame()) counts.merge(record.getEntityId(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Restaure le ledger et renvoie la dernière note par entité, prête à charger dans le store.
     */
    public static Map<String, RatingRecord> rehydrate(RatingLedger ledger, Collection<RatingRecord> records) {
        ledger.replaceWith(records);
        return latestPerEntity(records);
    }
}
