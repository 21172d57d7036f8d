package com.gnovoa.cricket.rosters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.PlayerRole;
import com.gnovoa.cricket.model.Squad;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SquadCatalogTest {

  private static SquadCatalog catalog(Map<String, String> files) {
    SimProperties props =
        new SimProperties(null, null, null, new SimProperties.Squads(files), null, null, null, null);
    return new SquadCatalog(new ObjectMapper(), props);
  }

  private static Map<String, String> shipped() {
    Map<String, String> files = new LinkedHashMap<>();
    files.put("england", "squads/england.json");
    files.put("australia", "squads/australia.json");
    return files;
  }

  @Test
  void loadsTheShippedSquadsInConfigurationOrder() {
    SquadCatalog catalog = catalog(shipped());

    assertThat(catalog.squads()).extracting(Squad::teamId).containsExactly("england", "australia");
    Squad england = catalog.squad("england");
    assertThat(england.name()).isEqualTo("England");
    assertThat(england.shortName()).isEqualTo("ENG");
    assertThat(england.players()).hasSizeGreaterThanOrEqualTo(11);
    assertThat(england.players()).anyMatch(p -> p.role() == PlayerRole.WICKET_KEEPER);
  }

  @Test
  void unknownTeamIsRejected() {
    SquadCatalog catalog = catalog(shipped());

    assertThatThrownBy(() -> catalog.squad("india"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("india");
  }

  @Test
  void noConfiguredSquadsIsAnEmptyCatalog() {
    assertThat(catalog(Map.of()).squads()).isEmpty();
  }

  @Test
  void missingFileFailsFast() {
    assertThatThrownBy(() -> catalog(Map.of("nowhere", "squads/nowhere.json")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("squads/nowhere.json");
  }

  @Test
  void teamIdMustMatchItsKey() {
    assertThatThrownBy(() -> catalog(Map.of("scotland", "squads/england.json")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("scotland")
        .hasRootCauseMessage(
            "Squad team id england does not match scotland in squads/england.json");
  }

  @Test
  void squadTooSmallForAnXiIsRejected() {
    assertThatThrownBy(() -> catalog(Map.of("short", "squads/short.json")))
        .isInstanceOf(IllegalStateException.class)
        .rootCause()
        .hasMessageContaining("at least 11 players");
  }

  @Test
  void duplicatePlayerIdsAreRejected() {
    assertThatThrownBy(() -> catalog(Map.of("duplicates", "squads/duplicates.json")))
        .isInstanceOf(IllegalStateException.class)
        .rootCause()
        .hasMessageContaining("Duplicate player id dup-3");
  }
}
