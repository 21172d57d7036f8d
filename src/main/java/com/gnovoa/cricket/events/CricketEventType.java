package com.gnovoa.cricket.events;

public enum CricketEventType {
    BALL,
    WICKET,
    OVER_COMPLETE,
    SESSION_BREAK,
    STUMPS,
    INNINGS_COMPLETE,
    FOLLOW_ON,
    DECLARATION,
    MATCH_SNAPSHOT,
    MATCH_COMPLETE
}
