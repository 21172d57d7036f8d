package com.gnovoa.cricket.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** A playing XI; {@code players} is the batting order. */
public record Team(String teamId, String name, String shortName, List<Player> players) {

    public Team {
        if (players == null || players.isEmpty()) {
            throw new IllegalArgumentException("Team " + name + " has no players");
        }
        players = List.copyOf(players);
    }

    /** @return bowlers and all-rounders, best bowling rating first */
    public List<Player> bowlers() {
        return players.stream()
                .filter(p -> p.role().bowls())
                .sorted(Comparator.comparingInt(Player::bowlingRating).reversed())
                .toList();
    }

    public Optional<Player> wicketKeeper() {
        return players.stream().filter(p -> p.role() == PlayerRole.WICKET_KEEPER).findFirst();
    }

    public boolean contains(Player player) {
        return players.contains(player);
    }
}
