package com.gnovoa.cricket.model;

public record BowlingRatings(int pace, int accuracy, int variation, int stamina, BowlingStyle style) {
    public BowlingRatings {
        Ratings.require("bowling.pace", pace);
        Ratings.require("bowling.accuracy", accuracy);
        Ratings.require("bowling.variation", variation);
        Ratings.require("bowling.stamina", stamina);
        if (style == null) style = BowlingStyle.MEDIUM;
    }

    public int overall() {
        return Ratings.mean(pace, accuracy, variation, stamina);
    }
}
