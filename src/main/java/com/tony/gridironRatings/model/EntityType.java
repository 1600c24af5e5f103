package com.tony.gridironRatings.model;

public enum EntityType {
    TEAM,
    PLAYER
}
