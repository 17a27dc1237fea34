package oracle.arbitrage.service.recommendation;

/**
 * What to do with a network pair when the cost estimate has no entry for one of its networks.
 */
public enum MissingCostPolicy {
    /** Count the missing cost as zero; the profit is then an upper bound. */
    ASSUME_ZERO,
    /** Leave the pair out of the ranking. */
    EXCLUDE
}
