package com.gnovoa.cricket.model;

import java.util.List;

/** A touring squad as loaded from JSON; the playing XI is picked from it per match. */
public record Squad(String teamId, String name, String shortName, List<PlayerProfile> players) {}
