package com.tony.gridironRatings.model.dto;

import com.tony.gridironRatings.model.RosterSlot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class TeamAdjustmentRequest {
    @NotNull
    private List<@Valid RosterSlot> roster = new ArrayList<>();
}
