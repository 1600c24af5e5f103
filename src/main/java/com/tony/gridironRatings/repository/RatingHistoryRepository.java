package com.tony.gridironRatings.repository;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import com.tony.gridironRatings.config.RatingProperties;
import com.tony.gridironRatings.model.EntityType;
import com.tony.gridironRatings.model.Position;
import com.tony.gridironRatings.model.RatingEvent;
import com.tony.gridironRatings.model.RatingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Historique des notes sur disque : un CSV par store.
 * <ul>
 *     <li>équipes : season, week, team_id, elo_rating, event</li>
 *     <li>joueurs : season, week, player_id, position, elo_rating, event</li>
 * </ul>
 * La colonne event (GAME / REVERSION) est facultative à la relecture : absente, la ligne vaut GAME.
 * Un fichier absent ou illisible équivaut à "pas d'historique" : le store démarre à froid.
 */
@Repository
@Slf4j
public class RatingHistoryRepository {

    static final String[] TEAM_HEADER = {"season", "week", "team_id", "elo_rating", "event"};
    static final String[] PLAYER_HEADER = {"season", "week", "player_id", "position", "elo_rating", "event"};

    private final RatingProperties.History config;

    public RatingHistoryRepository(RatingProperties properties) {
        this.config = properties.getHistory();
    }

    public Path pathFor(EntityType type) {
        String file = type == EntityType.TEAM ? config.getTeamFile() : config.getPlayerFile();
        return Paths.get(config.getDirectory(), file);
    }

    /**
     * Écrit tout l'historique du store (le fichier est réécrit, l'ordre d'insertion est conservé).
     */
    public void save(EntityType type, List<RatingRecord> records) {
        if (records.isEmpty()) {
            log.warn("⚠️ Aucun historique {} à sauvegarder", type);
            return;
        }
        Path path = pathFor(type);
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(out)) {
                csv.writeNext(type == EntityType.TEAM ? TEAM_HEADER : PLAYER_HEADER, false);
                for (RatingRecord record : records) {
                    csv.writeNext(toRow(type, record), false);
                }
            }
            log.info("💾 Historique {} sauvegardé : {} lignes -> {}", type, records.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Impossible d'écrire l'historique " + path, e);
        }
    }

    /**
     * Relit l'historique d'un store. Fichier absent ou corrompu : liste vide (démarrage à froid).
     */
    public List<RatingRecord> load(EntityType type) {
        Path path = pathFor(type);
        if (!Files.exists(path)) {
            log.warn("⚠️ Pas d'historique {} trouvé à {}", type, path);
            return List.of();
        }
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(in)) {
            List<String[]> rows = csv.readAll();
            List<RatingRecord> records = new ArrayList<>();
            // Ligne 0 = en-tête
            for (int i = 1; i < rows.size(); i++) {
                records.add(fromRow(type, rows.get(i)));
            }
            log.info("📂 Historique {} chargé : {} lignes depuis {}", type, records.size(), path);
            return records;
        } catch (IOException | CsvException | RuntimeException e) {
            log.warn("⚠️ Historique {} illisible ({}), démarrage à froid : {}", type, path, e.getMessage());
            return List.of();
        }
    }

    private String[] toRow(EntityType type, RatingRecord record) {
        String season = String.valueOf(record.getSeason());
        String week = String.valueOf(record.getWeek());
        // Double.toString : relecture identique au bit près
        String rating = Double.toString(record.getRating());
        String event = record.getEvent().name();
        if (type == EntityType.TEAM) {
            return new String[]{season, week, record.getEntityId(), rating, event};
        }
        Position position = record.getPosition() != null ? record.getPosition() : Position.UNKNOWN;
        return new String[]{season, week, record.getEntityId(), position.name(), rating, event};
    }

    private RatingRecord fromRow(EntityType type, String[] row) {
        int full = type == EntityType.TEAM ? TEAM_HEADER.length : PLAYER_HEADER.length;
        if (row.length != full && row.length != full - 1) {
            throw new IllegalArgumentException("ligne de " + row.length + " colonnes, " + full + " attendues");
        }
        int season = Integer.parseInt(row[0].trim());
        int week = Integer.parseInt(row[1].trim());
        RatingEvent event = row.length == full ? RatingEvent.fromCode(row[full - 1]) : RatingEvent.GAME;
        if (type == EntityType.TEAM) {
            return new RatingRecord(season, week, row[2], EntityType.TEAM, null, Double.parseDouble(row[3].trim()), event);
        }
        return new RatingRecord(season, week, row[2], EntityType.PLAYER, Position.fromCode(row[3]),
                Double.parseDouble(row[4].trim()), event);
    }
}
