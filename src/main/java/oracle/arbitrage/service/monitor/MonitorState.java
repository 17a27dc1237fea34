package oracle.arbitrage.service.monitor;

public enum MonitorState {
    IDLE,
    POLLING,
    TRIGGERED,
    STOPPED
}
