package com.tony.gridironRatings.controller;

import com.tony.gridironRatings.model.EntityType;
import com.tony.gridironRatings.model.LeaderboardEntry;
import com.tony.gridironRatings.model.MatchupProbability;
import com.tony.gridironRatings.model.Position;
import com.tony.gridironRatings.model.RatingRecord;
import com.tony.gridironRatings.model.RatingSummary;
import com.tony.gridironRatings.model.dto.AdjustedMatchupRequest;
import com.tony.gridironRatings.model.dto.TeamAdjustmentRequest;
import com.tony.gridironRatings.service.RatingQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ratings")
@RequiredArgsConstructor
public class RatingController {
    private final RatingQueryService queryService;

    @GetMapping("/teams")
    public ResponseEntity<List<String>> getKnownTeams() {
        return ResponseEntity.ok(queryService.knownTeams());
    }

    // Équipe jamais vue : note de base, jamais de 404
    @GetMapping("/teams/{teamId}")
    public ResponseEntity<Map<String, Object>> getTeamRating(@PathVariable String teamId) {
        return ResponseEntity.ok(Map.of("teamId", teamId, "rating", queryService.teamRating(teamId)));
    }

    @GetMapping("/players/{playerId}")
    public ResponseEntity<Map<String, Object>> getPlayerRating(@PathVariable String playerId) {
        return ResponseEntity.ok(Map.of("playerId", playerId, "rating", queryService.playerRating(playerId)));
    }

    @GetMapping("/teams/{teamId}/history")
    public ResponseEntity<List<RatingRecord>> getTeamHistory(@PathVariable String teamId) {
        return ResponseEntity.ok(queryService.teamTrajectory(teamId));
    }

    @GetMapping("/players/{playerId}/history")
    public ResponseEntity<List<RatingRecord>> getPlayerHistory(@PathVariable String playerId) {
        return ResponseEntity.ok(queryService.playerTrajectory(playerId));
    }

    @GetMapping("/teams/leaderboard")
    public ResponseEntity<List<LeaderboardEntry>> getTeamLeaderboard(@RequestParam(defaultValue = "32") int limit) {
        return ResponseEntity.ok(queryService.teamLeaderboard(limit));
    }

    @GetMapping("/players/leaderboard")
    public ResponseEntity<List<LeaderboardEntry>> getPlayerLeaderboard(
            @RequestParam(required = false) Position position,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(queryService.playerLeaderboard(position, limit));
    }

    @GetMapping("/summary/{type}")
    public ResponseEntity<RatingSummary> getSummary(@PathVariable EntityType type) {
        return ResponseEntity.ok(queryService.summary(type));
    }

    @GetMapping("/matchup")
    public ResponseEntity<MatchupProbability> getMatchup(
            @RequestParam String home,
            @RequestParam String away,
            @RequestParam(defaultValue = "false") boolean neutral) {
        return ResponseEntity.ok(queryService.matchupProbability(home, away, neutral));
    }

    @PostMapping("/matchup/adjusted")
    public ResponseEntity<MatchupProbability> getAdjustedMatchup(@Valid @RequestBody AdjustedMatchupRequest request) {
        return ResponseEntity.ok(queryService.adjustedMatchupProbability(request.getHomeTeam(), request.getAwayTeam(),
                request.isNeutralSite(), request.getHomeRoster(), request.getAwayRoster()));
    }

    @PostMapping("/team-adjustment")
    public ResponseEntity<Map<String, Double>> getTeamAdjustment(@Valid @RequestBody TeamAdjustmentRequest request) {
        return ResponseEntity.ok(Map.of("adjustment", queryService.teamAdjustment(request.getRoster())));
    }
}
