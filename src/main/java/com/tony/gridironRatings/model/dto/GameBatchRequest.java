package com.tony.gridironRatings.model.dto;

import com.tony.gridironRatings.model.GameOutcome;
import com.tony.gridironRatings.model.RosterEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class GameBatchRequest {
    @NotNull
    private List<@Valid GameOutcome> games = new ArrayList<>();

    // Feuilles de match, rattachées aux matchs via (gameId, teamId)
    private List<@Valid RosterEntry> rosters = new ArrayList<>();
}
