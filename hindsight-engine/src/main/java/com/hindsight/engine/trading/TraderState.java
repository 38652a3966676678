package com.hindsight.engine.trading;

public enum TraderState {
    INITIALIZED,
    RUNNING,
    STOPPED,
    DISPOSED
}
