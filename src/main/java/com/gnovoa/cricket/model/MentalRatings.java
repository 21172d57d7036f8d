package com.gnovoa.cricket.model;

public record MentalRatings(int concentration, int pressure, int adaptability) {
    public MentalRatings {
        Ratings.require("mental.concentration", concentration);
        Ratings.require("mental.pressure", pressure);
        Ratings.require("mental.adaptability", adaptability);
    }
}
