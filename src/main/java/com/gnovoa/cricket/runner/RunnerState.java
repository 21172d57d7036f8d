package com.gnovoa.cricket.runner;

public enum RunnerState {
    IDLE,
    RUNNING,
    PAUSED,
    STOPPED,
    DONE
}
