package xyz.firestige.fleet.domain.campaign;

public enum LogLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
