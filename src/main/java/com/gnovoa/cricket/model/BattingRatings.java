package com.gnovoa.cricket.model;

public record BattingRatings(int timing, int power, int technique, int temperament, BattingStyle style) {
    public BattingRatings {
        Ratings.require("batting.timing", timing);
        Ratings.require("batting.power", power);
        Ratings.require("batting.technique", technique);
        Ratings.require("batting.temperament", temperament);
        if (style == null) style = BattingStyle.BALANCED;
    }

    public int overall() {
        return Ratings.mean(timing, power, technique, temperament);
    }
}
