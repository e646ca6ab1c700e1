package xyz.firestige.coordinator.domain.port;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
