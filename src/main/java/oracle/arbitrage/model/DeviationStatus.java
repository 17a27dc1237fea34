package oracle.arbitrage.model;

public enum DeviationStatus {
    INSUFFICIENT_DATA,
    WITHIN_THRESHOLD,
    THRESHOLD_EXCEEDED
}
