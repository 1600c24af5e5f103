package com.tony.gridironRatings.model.dto;

import com.tony.gridironRatings.model.RosterSlot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class AdjustedMatchupRequest {
    @NotBlank
    private String homeTeam;
    @NotBlank
    private String awayTeam;
    private boolean neutralSite;

    private List<@Valid RosterSlot> homeRoster = new ArrayList<>();
    private List<@Valid RosterSlot> awayRoster = new ArrayList<>();
}
