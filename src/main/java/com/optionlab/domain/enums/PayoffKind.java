package com.optionlab.domain.enums;

/**
 * Supported payoff kinds. The first three depend only on the terminal price; ASIAN_CALL and
 * LOOKBACK_CALL need the full simulated price path.
 */
public enum PayoffKind {

    /** max(S_T - K, 0). */
    VANILLA_CALL,

    /** max(K - S_T, 0). */
    VANILLA_PUT,

    /** Fixed cash amount when S_T lies in (lower, upper], otherwise nothing. */
    CASH_OR_NOTHING,

    /** max(arithmetic average of the path - K, 0). */
    ASIAN_CALL,

    /** max(path maximum - K, 0). */
    LOOKBACK_CALL
}
