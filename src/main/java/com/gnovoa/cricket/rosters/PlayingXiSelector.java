package com.gnovoa.cricket.rosters;

import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.PlayerProfile;
import com.gnovoa.cricket.model.PlayerRole;
import com.gnovoa.cricket.model.Squad;
import com.gnovoa.cricket.model.Team;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Picks a balanced XI from a squad. The returned order is the batting order: specialist batters,
 * all-rounders, the keeper, then the bowlers.
 */
public final class PlayingXiSelector {

  static final int XI = 11;

  private PlayingXiSelector() {}

  /**
   * Five best batters, up to two all-rounders, the best batting keeper, three pace bowlers and a
   * spinner, then the best remaining bowlers. If roles still leave gaps, the best remaining
   * players by overall rating fill them.
   *
   * <p>Every call builds fresh {@link Player}s, so match state never leaks between matches.
   *
   * @throws IllegalArgumentException if the squad has fewer than eleven players
   */
  public static Team selectPlayingXI(Squad squad) {
    List<PlayerProfile> pool = squad.players();
    if (pool == null || pool.size() < XI) {
      throw new IllegalArgumentException(
          "Squad " + squad.name() + " has " + (pool == null ? 0 : pool.size()) + " players, needs " + XI);
    }

    List<PlayerProfile> xi = new ArrayList<>();
    take(xi, pool, byRole(PlayerRole.BATSMAN), battingFirst(), 5);
    take(xi, pool, byRole(PlayerRole.ALL_ROUNDER),
        Comparator.comparingInt((PlayerProfile p) -> p.batting().overall() + p.bowling().overall()).reversed(), 2);
    take(xi, pool, byRole(PlayerRole.WICKET_KEEPER), battingFirst(), 1);

    Predicate<PlayerProfile> bowler = byRole(PlayerRole.BOWLER);
    take(xi, pool, bowler.and(p -> p.bowling().style().isPace()), bowlingFirst(), 3);
    take(xi, pool, bowler.and(p -> p.bowling().style().isSpin()), bowlingFirst(), 1);
    take(xi, pool, bowler, bowlingFirst(), XI - xi.size());

    take(xi, pool, p -> true,
        Comparator.comparingInt((PlayerProfile p) -> Math.max(p.batting().overall(), p.bowling().overall()))
            .reversed(),
        XI - xi.size());

    return new Team(
        squad.teamId(),
        squad.name(),
        squad.shortName(),
        xi.stream().map(Player::new).toList());
  }

  private static void take(
      List<PlayerProfile> xi,
      List<PlayerProfile> pool,
      Predicate<PlayerProfile> filter,
      Comparator<PlayerProfile> order,
      int count) {
    if (count <= 0) return;
    pool.stream()
        .filter(p -> !xi.contains(p))
        .filter(filter)
        .sorted(order)
        .limit(Math.min(count, XI - xi.size()))
        .forEach(xi::add);
  }

  private static Predicate<PlayerProfile> byRole(PlayerRole role) {
    return p -> p.role() == role;
  }

  private static Comparator<PlayerProfile> battingFirst() {
    return Comparator.comparingInt((PlayerProfile p) -> p.batting().overall()).reversed();
  }

  private static Comparator<PlayerProfile> bowlingFirst() {
    return Comparator.comparingInt((PlayerProfile p) -> p.bowling().overall()).reversed();
  }
}
