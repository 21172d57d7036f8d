package com.gnovoa.cricket.core;

public enum FormatKind {
    LIMITED_OVERS,
    MULTI_DAY
}
