package com.gnovoa.cricket.rosters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.PlayerProfile;
import com.gnovoa.cricket.model.Squad;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Loads and validates squads from the classpath.
 *
 * <p>Squads are configured via {@code sim.squads.files.*} (team id to classpath location) and are
 * expected to be JSON matching {@link Squad}.
 *
 * <p>All squads are kept in memory (no DB). The catalog is built once at application startup and
 * fails fast if any squad file is missing or invalid.
 */
@Component
public final class SquadCatalog {

  private static final Logger log = LoggerFactory.getLogger(SquadCatalog.class);

  /** Smallest squad a playing XI can be picked from. */
  static final int MIN_SQUAD_SIZE = 11;

  /** In-memory squad cache by team id, in configuration order. */
  private final Map<String, Squad> squads = new LinkedHashMap<>();

  /**
   * Loads all configured squads into memory.
   *
   * @param mapper Jackson mapper used to deserialize squad files
   * @param props simulation properties (includes squad file locations)
   * @throws IllegalStateException if a squad file cannot be read, parsed or validated
   */
  public SquadCatalog(ObjectMapper mapper, SimProperties props) {
    props
        .squads()
        .files()
        .forEach(
            (teamId, location) -> {
              try (var in = new ClassPathResource(location).getInputStream()) {
                Squad squad = mapper.readValue(in, Squad.class);
                validate(squad, teamId, location);
                squads.put(teamId, squad);
              } catch (Exception e) {
                throw new IllegalStateException(
                    "Failed to load squad " + teamId + " from " + location, e);
              }
            });
    log.info("Loaded {} squads: {}", squads.size(), squads.keySet());
  }

  /**
   * Returns the squad for the given team.
   *
   * @param teamId team identifier, as configured
   * @return loaded squad (never null)
   * @throws IllegalArgumentException if no squad is loaded for the team
   */
  public Squad squad(String teamId) {
    Squad s = squads.get(teamId);
    if (s == null) throw new IllegalArgumentException("No squad loaded for " + teamId);
    return s;
  }

  public List<Squad> squads() {
    return List.copyOf(squads.values());
  }

  /**
   * Validates a squad:
   *
   * <ul>
   *   <li>Squad team id must match the id it is configured under
   *   <li>At least eleven players, with unique player ids
   *   <li>At least two players able to bowl
   * </ul>
   */
  private void validate(Squad squad, String expectedTeamId, String location) {
    if (!expectedTeamId.equals(squad.teamId())) {
      throw new IllegalArgumentException(
          "Squad team id " + squad.teamId() + " does not match " + expectedTeamId + " in " + location);
    }
    List<PlayerProfile> players = squad.players();
    if (players == null || players.size() < MIN_SQUAD_SIZE) {
      throw new IllegalArgumentException(
          "Squad " + squad.name() + " must have at least " + MIN_SQUAD_SIZE + " players (file " + location + ")");
    }
    Set<String> ids = new HashSet<>();
    for (PlayerProfile p : players) {
      if (!ids.add(p.playerId())) {
        throw new IllegalArgumentException(
            "Duplicate player id " + p.playerId() + " in squad " + squad.name() + " (file " + location + ")");
      }
    }
    long bowlers = players.stream().filter(p -> p.role().bowls()).count();
    if (bowlers < 2) {
      throw new IllegalArgumentException(
          "Squad " + squad.name() + " needs at least two bowlers (file " + location + ")");
    }
  }
}
