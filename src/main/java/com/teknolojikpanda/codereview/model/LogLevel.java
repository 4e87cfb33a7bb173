package com.teknolojikpanda.codereview.model;

public enum LogLevel {
    INFO,
    WARNING,
    ERROR
}
