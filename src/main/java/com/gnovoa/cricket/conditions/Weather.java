package com.gnovoa.cricket.conditions;

public enum Weather {
    SUNNY,
    OVERCAST,
    HUMID,
    RAIN,
    WINDY
}
