package com.optionlab.domain.enums;

/**
 * Time-stepping scheme for the Black-Scholes PDE solver.
 *
 * <p>IMPLICIT and CRANK_NICOLSON are unconditionally stable. EXPLICIT is accepted only when the
 * grid satisfies sigma^2 * S^2 * dt / dS^2 <= 1 at every node.
 */
public enum FiniteDifferenceScheme {
    IMPLICIT,
    CRANK_NICOLSON,
    EXPLICIT
}
