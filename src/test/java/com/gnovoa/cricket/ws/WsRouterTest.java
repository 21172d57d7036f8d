package com.gnovoa.cricket.ws;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WsRouterTest {

  @Test
  void matchPathsRouteToTheMatchKey() {
    assertThat(WsRouter.routeKey("/ws/matches/m-123")).isEqualTo("match:m-123");
    assertThat(WsRouter.routeKey("/ws/matches/m-123")).isEqualTo(WsRouter.matchKey("m-123"));
  }

  @Test
  void otherPathsAreUnknown() {
    assertThat(WsRouter.routeKey("/ws/leagues/x")).isEqualTo(WsRouter.UNKNOWN);
    assertThat(WsRouter.routeKey("")).isEqualTo(WsRouter.UNKNOWN);
  }

  @Test
  void noSubscribersIsAnEmptySet() {
    assertThat(new WsRouter().forKey("match:none")).isEmpty();
  }
}
