package com.gnovoa.cricket.api.dto;

import com.gnovoa.cricket.core.MatchSnapshot;

/** Result of a fast-forward: how many deliveries were bowled and where the match now stands. */
public record AdvanceResponse(int ballsBowled, MatchSnapshot match) {}
