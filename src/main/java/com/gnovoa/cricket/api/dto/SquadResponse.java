package com.gnovoa.cricket.api.dto;

import java.util.List;

public record SquadResponse(String teamId, String name, String shortName, List<SquadPlayer> players) {

    public record SquadPlayer(String playerId, String name, String role, int batting, int bowling) {}
}
