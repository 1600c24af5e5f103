package com.tony.gridironRatings.ledger;

import com.tony.gridironRatings.model.RatingRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Historique append-only des notes d'un store.
 * <p>
 * Précondition (non vérifiée) : pour une même entité, les enregistrements arrivent dans l'ordre
 * (saison, semaine) croissant. Un ajout dans le désordre fausse la reconstruction "dernière note".
 * <p>
 * Pas de synchronisation ici : le store propriétaire sérialise les accès sous son propre verrou.
 */
public class RatingLedger {

    private final List<RatingRecord> records = new ArrayList<>();

    public void append(RatingRecord record) {
        records.add(Objects.requireNonNull(record, "record"));
    }

    /**
     * Copie figée, dans l'ordre d'insertion.
     */
    public List<RatingRecord> records() {
        return List.copyOf(records);
    }

    /**
     * Trajectoire d'une entité, dans l'ordre d'insertion (donc chronologique si la précondition est respectée).
     */
    public List<RatingRecord> historyOf(String entityId) {
        return records.stream()
                .filter(r -> r.getEntityId().equals(entityId))
                .toList();
    }

    // Réservé à la restauration depuis le disque
    void replaceWith(Collection<RatingRecord> restored) {
        records.clear();
        records.addAll(restored);
    }
}
