package com.gnovoa.cricket.model;

public enum BattingStyle {
    AGGRESSIVE,
    BALANCED,
    DEFENSIVE,
    ANCHOR
}
