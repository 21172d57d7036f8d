package com.gnovoa.cricket.conditions;

public enum GroundSize {
    SMALL,
    MEDIUM,
    LARGE
}
