package com.optionlab.unit.pricing;

import static com.optionlab.domain.enums.FiniteDifferenceScheme.CRANK_NICOLSON;
import static com.optionlab.domain.enums.FiniteDifferenceScheme.EXPLICIT;
import static com.optionlab.domain.enums.FiniteDifferenceScheme.IMPLICIT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optionlab.config.PricingProperties;
import com.optionlab.domain.enums.FiniteDifferenceScheme;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.DiagnosticGrid;
import com.optionlab.domain.model.FiniteDifferenceConfig;
import com.optionlab.domain.model.LatticeConfig;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.exception.ErrorCode;
import com.optionlab.exception.InvalidParameterException;
import com.optionlab.exception.NumericalInstabilityException;
import com.optionlab.payoff.AsianCall;
import com.optionlab.payoff.CashOrNothing;
import com.optionlab.payoff.VanillaCall;
import com.optionlab.payoff.VanillaPut;
import com.optionlab.pricing.analytic.AnalyticPricer;
import com.optionlab.pricing.analytic.FiniteDifferencePricer;
import com.optionlab.pricing.lattice.LatticePricer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for FiniteDifferencePricer: accuracy of the three schemes against closed forms, the
 * explicit stability check, American projection and the diagnostic grid.
 */
class FiniteDifferencePricerTest {

    private static final double BLACK_SCHOLES_CALL = 10.450583572185565;

    private FiniteDifferencePricer finiteDifferencePricer;
    private AnalyticPricer analyticPricer;
    private MarketParameters atTheMoney;

    @BeforeEach
    void setUp() {
        finiteDifferencePricer = new FiniteDifferencePricer();
        analyticPricer = new AnalyticPricer();
        atTheMoney = MarketParameters.builder()
                .spot(100)
                .volatility(0.2)
                .riskFreeRate(0.05)
                .dividendYield(0.0)
                .timeToExpiry(1.0)
                .build();
    }

    private static FiniteDifferenceConfig grid(int priceSteps, int timeSteps, FiniteDifferenceScheme scheme) {
        return FiniteDifferenceConfig.builder()
                .priceSteps(priceSteps)
                .timeSteps(timeSteps)
                .scheme(scheme)
                .widthInStdDevs(5.0)
                .snapshotCount(10)
                .build();
    }

    @Nested
    @DisplayName("Vanilla accuracy")
    class VanillaAccuracy {

        @Test
        @DisplayName("Implicit scheme prices the ATM call within 0.01")
        void implicitCall() {
            PricingResult result = finiteDifferencePricer.price(
                    atTheMoney, OptionSpec.european(new VanillaCall(100)), grid(400, 400, IMPLICIT));

            assertThat(result.getMethod()).isEqualTo(PricingMethod.FINITE_DIFFERENCE);
            assertThat(result.getValue()).isCloseTo(BLACK_SCHOLES_CALL, within(0.01));
        }

        @Test
        @DisplayName("Crank-Nicolson prices the ATM call within 0.005")
        void crankNicolsonCall() {
            PricingResult result = finiteDifferencePricer.price(
                    atTheMoney, OptionSpec.european(new VanillaCall(100)), grid(400, 400, CRANK_NICOLSON));

            assertThat(result.getValue()).isCloseTo(BLACK_SCHOLES_CALL, within(0.005));
        }

        @Test
        @DisplayName("Explicit scheme inside its stability limit prices the call within 0.02")
        void explicitCall() {
            PricingResult result = finiteDifferencePricer.price(
                    atTheMoney, OptionSpec.european(new VanillaCall(100)), grid(100, 400, EXPLICIT));

            assertThat(result.getValue()).isCloseTo(BLACK_SCHOLES_CALL, within(0.02));
        }

        @Test
        @DisplayName("Implicit scheme prices the ATM put within 0.01")
        void implicitPut() {
            PricingResult result = finiteDifferencePricer.price(
                    atTheMoney, OptionSpec.european(new VanillaPut(100)), grid(400, 400, IMPLICIT));

            assertThat(result.getValue()).isCloseTo(5.573526022256971, within(0.01));
        }
    }

    @Test
    @DisplayName("Cash-or-nothing window matches its closed form within 0.01")
    void cashOrNothingWindow() {
        MarketParameters market = atTheMoney.toBuilder().volatility(0.1).build();
        double reference = analyticPricer.cashOrNothingPrice(100, 110, 120, 1.0, 0.05, 0.0, 0.1, 10);

        PricingResult result = finiteDifferencePricer.price(
                market,
                OptionSpec.european(new CashOrNothing(110, 120, 10)),
                grid(400, 400, IMPLICIT));

        assertThat(result.getValue()).isCloseTo(reference, within(0.01));
    }

    @Nested
    @DisplayName("Discontinuous payoffs")
    class DiscontinuousPayoffs {

        @Test
        @DisplayName("Window paying 10 on (110, 120] at sigma 0.2 matches its closed form on the default grid")
        void windowAtDefaultGrid() {
            double reference = analyticPricer.cashOrNothingPrice(100, 110, 120, 1.0, 0.05, 0.0, 0.2, 10);

            PricingResult result = finiteDifferencePricer.price(
                    atTheMoney, OptionSpec.european(new CashOrNothing(110, 120, 10)), grid(400, 400, IMPLICIT));

            assertThat(reference).isCloseTo(1.41597, within(1e-4));
            assertThat(result.getValue()).isCloseTo(reference, within(0.005));
        }

        @Test
        @DisplayName("Window value stays put as the price grid is refined")
        void windowStableUnderRefinement() {
            OptionSpec window = OptionSpec.european(new CashOrNothing(110, 120, 10));

            double coarse = finiteDifferencePricer.price(atTheMoney, window, grid(400, 400, IMPLICIT)).getValue();
            double fine = finiteDifferencePricer.price(atTheMoney, window, grid(800, 400, IMPLICIT)).getValue();

            assertThat(fine).isCloseTo(coarse, within(0.002));
        }
    }

    @Nested
    @DisplayName("Grid sizing")
    class GridSizing {

        @Test
        @DisplayName("High volatility long dated call matches the closed form on the default grid")
        void highVolatilityCall() {
            MarketParameters market = atTheMoney.toBuilder().volatility(1.0).timeToExpiry(3.0).build();
            OptionSpec call = OptionSpec.european(new VanillaCall(100));
            double reference = analyticPricer.price(market, call).getValue();

            PricingResult result = finiteDifferencePricer.price(market, call, grid(400, 400, IMPLICIT));

            assertThat(reference).isCloseTo(64.209, within(1e-3));
            assertThat(result.getValue()).isCloseTo(reference, within(0.05));
            DiagnosticGrid grid = result.getDiagnosticGrid();
            assertThat(grid.getMaxPrice()).isLessThanOrEqualTo(100.0 * 400 / 10);
            assertThat(100.0 / grid.getPriceStep()).isGreaterThanOrEqualTo(10.0);
        }

        @Test
        @DisplayName("Moderately wide distribution keeps put and call accurate")
        void wideDistributionPut() {
            MarketParameters market = atTheMoney.toBuilder().volatility(0.8).timeToExpiry(2.0).build();
            OptionSpec put = OptionSpec.european(new VanillaPut(100));
            double reference = analyticPricer.price(market, put).getValue();

            PricingResult result = finiteDifferencePricer.price(market, put, grid(400, 400, IMPLICIT));

            assertThat(result.getValue()).isCloseTo(reference, within(0.02));
        }

        @Test
        @DisplayName("Grid leaving too few steps below spot is rejected")
        void tooFewNodesBelowSpot() {
            assertThatThrownBy(() -> finiteDifferencePricer.price(
                            atTheMoney, OptionSpec.european(new VanillaPut(1000)), grid(20, 100, IMPLICIT)))
                    .isInstanceOf(NumericalInstabilityException.class)
                    .hasMessageContaining("PDE grid too coarse")
                    .satisfies(e -> assertThat(((NumericalInstabilityException) e).getDetails())
                            .containsEntry("priceSteps", 20)
                            .containsEntry("maxPrice", 2000.0));
        }
    }

    @Test
    @DisplayName("American put agrees with the lattice")
    void americanPutMatchesLattice() {
        MarketParameters market = MarketParameters.builder()
                .spot(50)
                .volatility(0.4)
                .riskFreeRate(0.1)
                .dividendYield(0.0)
                .timeToExpiry(5.0 / 12.0)
                .build();
        OptionSpec spec = OptionSpec.american(new VanillaPut(50));
        double lattice = new LatticePricer(new PricingProperties())
                .price(market, spec, LatticeConfig.ofSteps(1000))
                .getValue();

        PricingResult result = finiteDifferencePricer.price(market, spec, grid(400, 400, IMPLICIT));

        assertThat(result.getValue()).isCloseTo(lattice, within(0.02));
    }

    @Nested
    @DisplayName("Stability")
    class Stability {

        @Test
        @DisplayName("Explicit scheme with too few time steps is rejected with the grid in details")
        void explicitUnstable() {
            assertThatThrownBy(() -> finiteDifferencePricer.price(
                            atTheMoney,
                            OptionSpec.european(new VanillaCall(100)),
                            grid(200, 10, EXPLICIT)))
                    .isInstanceOf(NumericalInstabilityException.class)
                    .hasMessageContaining("Explicit scheme unstable")
                    .satisfies(e -> {
                        NumericalInstabilityException ex = (NumericalInstabilityException) e;
                        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NUMERICAL_INSTABILITY);
                        assertThat(ex.getDetails())
                                .containsEntry("scheme", "EXPLICIT")
                                .containsEntry("priceSteps", 200)
                                .containsEntry("timeSteps", 10);
                        assertThat((Double) ex.getDetails().get("stabilityRatio")).isGreaterThan(1.0);
                    });
        }

        @Test
        @DisplayName("Implicit scheme accepts the same coarse grid")
        void implicitUnconditionallyStable() {
            PricingResult result = finiteDifferencePricer.price(
                    atTheMoney, OptionSpec.european(new VanillaCall(100)), grid(200, 10, IMPLICIT));

            assertThat(result.getValue()).isCloseTo(BLACK_SCHOLES_CALL, within(0.25));
        }

        @Test
        @DisplayName("Path-dependent payoff is rejected")
        void pathDependentRejected() {
            assertThatThrownBy(() -> finiteDifferencePricer.price(
                            atTheMoney,
                            OptionSpec.european(new AsianCall(100)),
                            grid(100, 100, IMPLICIT)))
                    .isInstanceOf(InvalidParameterException.class);
        }
    }

    @Test
    @DisplayName("Diagnostic grid holds the payoff first and today's slice last")
    void diagnosticGrid() {
        PricingResult result = finiteDifferencePricer.price(
                atTheMoney, OptionSpec.european(new VanillaCall(100)), grid(400, 400, IMPLICIT));

        DiagnosticGrid grid = result.getDiagnosticGrid();
        assertThat(grid.getPrices()).hasSize(401);
        assertThat(grid.getPrices()[400]).isCloseTo(grid.getMaxPrice(), within(1e-9));
        assertThat(grid.getMaxPrice()).isGreaterThanOrEqualTo(200.0);
        assertThat(grid.getTimesToExpiry()).hasSize(12).startsWith(0.0);
        assertThat(grid.getTimesToExpiry().get(11)).isCloseTo(1.0, within(1e-12));
        assertThat(grid.getValues()).hasSize(12).allSatisfy(slice -> assertThat(slice).hasSize(401));
        // expiry slice is the payoff
        assertThat(grid.getValues().get(0)[400]).isCloseTo(grid.getMaxPrice() - 100, within(1e-9));
        assertThat(result.getSteps()).isEqualTo(400);
    }
}
