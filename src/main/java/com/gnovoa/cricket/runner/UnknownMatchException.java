package com.gnovoa.cricket.runner;

public final class UnknownMatchException extends IllegalArgumentException {

    public UnknownMatchException(String matchId) {
        super("Unknown match " + matchId);
    }
}
