package com.di.datapipe.state;

public enum LoadStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
