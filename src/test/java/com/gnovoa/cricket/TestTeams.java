package com.gnovoa.cricket;

import com.gnovoa.cricket.model.BattingRatings;
import com.gnovoa.cricket.model.BattingStyle;
import com.gnovoa.cricket.model.BowlingRatings;
import com.gnovoa.cricket.model.BowlingStyle;
import com.gnovoa.cricket.model.FieldingRatings;
import com.gnovoa.cricket.model.MentalRatings;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.PlayerProfile;
import com.gnovoa.cricket.model.PlayerRole;
import com.gnovoa.cricket.model.Team;

import java.util.ArrayList;
import java.util.List;

/** Hand-built XIs for unit tests. */
public final class TestTeams {

    private TestTeams() {}

    /**
     * Eleven players in batting order: five batters ({@code id-bat1..5}), a seam all-rounder
     * ({@code id-ar}), the keeper ({@code id-wk}), three fast bowlers ({@code id-pace1..3}) and an
     * off-spinner ({@code id-spin}).
     */
    public static Team xi(String teamId, String name) {
        List<Player> players = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            players.add(player(teamId + "-bat" + i, name + " Batter " + i, PlayerRole.BATSMAN,
                    70, BattingStyle.BALANCED, 20, BowlingStyle.MEDIUM));
        }
        players.add(player(teamId + "-ar", name + " All-rounder", PlayerRole.ALL_ROUNDER,
                60, BattingStyle.BALANCED, 65, BowlingStyle.FAST_MEDIUM));
        players.add(player(teamId + "-wk", name + " Keeper", PlayerRole.WICKET_KEEPER,
                60, BattingStyle.BALANCED, 10, BowlingStyle.MEDIUM));
        for (int i = 1; i <= 3; i++) {
            players.add(player(teamId + "-pace" + i, name + " Quick " + i, PlayerRole.BOWLER,
                    35, BattingStyle.DEFENSIVE, 80 - i, BowlingStyle.FAST));
        }
        players.add(player(teamId + "-spin", name + " Spinner", PlayerRole.BOWLER,
                30, BattingStyle.DEFENSIVE, 72, BowlingStyle.OFF_SPIN));
        return new Team(teamId, name, name.substring(0, 3).toUpperCase(), players);
    }

    public static Team home() {
        return xi("home", "Homeside");
    }

    public static Team away() {
        return xi("away", "Awayside");
    }

    /** A player whose four batting and four bowling ratings all equal the given values. */
    public static Player player(
            String id, String name, PlayerRole role,
            int batting, BattingStyle battingStyle,
            int bowling, BowlingStyle bowlingStyle) {
        return new Player(profile(id, name, role, batting, battingStyle, bowling, bowlingStyle));
    }

    public static PlayerProfile profile(
            String id, String name, PlayerRole role,
            int batting, BattingStyle battingStyle,
            int bowling, BowlingStyle bowlingStyle) {
        return new PlayerProfile(
                id,
                name,
                role,
                new BattingRatings(batting, batting, batting, batting, battingStyle),
                new BowlingRatings(bowling, bowling, bowling, bowling, bowlingStyle),
                new FieldingRatings(60, 60, 60),
                new MentalRatings(60, 60, 60));
    }

    public static Player byId(Team team, String id) {
        return team.players().stream()
                .filter(p -> p.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No " + id + " in " + team.name()));
    }
}
