package com.example.cronkeeper.domain.enums;

public enum DaemonStatus {
    RUNNING,
    STOPPED
}
