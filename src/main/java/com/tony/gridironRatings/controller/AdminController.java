package com.tony.gridironRatings.controller;

import com.tony.gridironRatings.model.dto.GameBatchRequest;
import com.tony.gridironRatings.model.dto.PipelineReport;
import com.tony.gridironRatings.service.PlayerEloService;
import com.tony.gridironRatings.service.RatingPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final RatingPipelineService pipelineService;
    private final PlayerEloService playerEloService;

    /**
     * Ingestion d'un lot de matchs terminés (+ feuilles de match), dans l'ordre chronologique.
     * Exemple : POST /api/v1/admin/games {"games": [...], "rosters": [...]}
     */
    @PostMapping("/games")
    public ResponseEntity<PipelineReport> ingestGames(@Valid @RequestBody GameBatchRequest request) {
        log.info("🚀 Ingestion de {} matchs et {} lignes d'effectif", request.getGames().size(), request.getRosters().size());
        return ResponseEntity.ok(pipelineService.process(request.getGames(), request.getRosters()));
    }

    @PostMapping("/history/save")
    public ResponseEntity<String> saveHistory() {
        pipelineService.saveHistory();
        return ResponseEntity.ok("Historiques Elo sauvegardés.");
    }

    @PostMapping("/history/reload")
    public ResponseEntity<String> reloadHistory() {
        log.info("🔄 Rechargement des historiques demandé par l'admin");
        pipelineService.restoreFromDisk();
        return ResponseEntity.ok("Historiques Elo rechargés (saison courante : " + pipelineService.getCurrentSeason() + ").");
    }

    @PostMapping("/players/regress-inactive")
    public ResponseEntity<Map<String, Integer>> regressInactive(@RequestParam int season, @RequestParam int week) {
        int count = playerEloService.regressInactive(season, week);
        return ResponseEntity.ok(Map.of("regressed", count));
    }
}
