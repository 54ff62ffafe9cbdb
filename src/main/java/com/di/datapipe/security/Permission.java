package com.di.datapipe.security;

public enum Permission {
    TRIGGER_PUBLISH,
    LANDING_WRITE,
    LANDING_READ,
    NOTIFICATION_PUBLISH,
    WAREHOUSE_READ,
    WAREHOUSE_WRITE
}
