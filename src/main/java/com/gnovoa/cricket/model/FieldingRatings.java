package com.gnovoa.cricket.model;

public record FieldingRatings(int catching, int throwing, int agility) {
    public FieldingRatings {
        Ratings.require("fielding.catching", catching);
        Ratings.require("fielding.throwing", throwing);
        Ratings.require("fielding.agility", agility);
    }

    public int overall() {
        return Ratings.mean(catching, throwing, agility);
    }
}
