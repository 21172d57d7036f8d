package com.gnovoa.cricket.core;

/** A completed stand between two batters; only stands worth at least one run are archived. */
public record Partnership(String batter1, String batter2, int runs, int balls) {}
