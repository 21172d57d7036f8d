package com.gnovoa.cricket.model;

import java.util.Objects;

/**
 * Immutable rated attributes of a player, as loaded from a squad file.
 *
 * <p>Missing rating groups default to an average (50) profile; ratings that are present must lie
 * in 1-100 or construction fails.
 */
public record PlayerProfile(
        String playerId,
        String name,
        PlayerRole role,
        BattingRatings batting,
        BowlingRatings bowling,
        FieldingRatings fielding,
        MentalRatings mental) {

    public PlayerProfile {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        if (batting == null) batting = new BattingRatings(50, 50, 50, 50, BattingStyle.BALANCED);
        if (bowling == null) bowling = new BowlingRatings(50, 50, 50, 50, BowlingStyle.MEDIUM);
        if (fielding == null) fielding = new FieldingRatings(50, 50, 50);
        if (mental == null) mental = new MentalRatings(50, 50, 50);
    }
}
