package com.optionlab.pricing.lattice;

import com.optionlab.domain.model.MarketParameters;
import com.optionlab.exception.ArbitrageViolationException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cox-Ross-Rubinstein tree parameters for one (market, step count) pair.
 *
 * <p>u = e^(sigma sqrt(dt)), d = 1/u, so an up move followed by a down move returns to the same
 * price and node (m, i) of layer m sits at S0 * u^(2i - m). The risk-neutral up probability is
 * p = (e^((r - q) dt) - d) / (u - d) and must lie strictly inside (0, 1); otherwise the tree
 * admits arbitrage and is rejected.
 */
record BinomialTree(double spot, int steps, double dt, double up, double down, double probability, double discount) {

    static BinomialTree crr(MarketParameters market, int steps) {
        double dt = market.getTimeToExpiry() / steps;
        double up = Math.exp(market.getVolatility() * Math.sqrt(dt));
        double down = 1.0 / up;
        double growth = Math.exp((market.getRiskFreeRate() - market.getDividendYield()) * dt);
        double probability = (growth - down) / (up - down);

        if (!(probability > 0.0 && probability < 1.0)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("volatility", market.getVolatility());
            details.put("riskFreeRate", market.getRiskFreeRate());
            details.put("dividendYield", market.getDividendYield());
            details.put("dt", dt);
            details.put("up", up);
            details.put("down", down);
            details.put("probability", probability);
            throw new ArbitrageViolationException(
                    String.format(
                            "Risk-neutral probability %.6f outside (0, 1) for sigma=%s, r=%s, q=%s, dt=%s; "
                                    + "increase the number of steps",
                            probability,
                            market.getVolatility(),
                            market.getRiskFreeRate(),
                            market.getDividendYield(),
                            dt),
                    details);
        }
        return new BinomialTree(
                market.getSpot(), steps, dt, up, down, probability, Math.exp(-market.getRiskFreeRate() * dt));
    }

    /** Price of node {@code index} (number of up moves) in layer {@code layer}. */
    double price(int layer, int index) {
        return spot * Math.pow(up, 2 * index - layer);
    }

    double time(int layer) {
        return layer * dt;
    }
}
