package com.optionlab.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionlab.api.controller.PricingController;
import com.optionlab.config.ApiResponseAdvice;
import com.optionlab.config.PricingProperties;
import com.optionlab.domain.enums.ExerciseStyle;
import com.optionlab.domain.enums.FiniteDifferenceScheme;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.ExerciseBoundaryPoint;
import com.optionlab.domain.model.FiniteDifferenceConfig;
import com.optionlab.domain.model.LatticeConfig;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.MonteCarloConfig;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.exception.ArbitrageViolationException;
import com.optionlab.exception.GlobalExceptionHandler;
import com.optionlab.exception.NumericalInstabilityException;
import com.optionlab.mapper.PricingRequestMapper;
import com.optionlab.payoff.CashOrNothing;
import com.optionlab.payoff.VanillaCall;
import com.optionlab.payoff.VanillaPut;
import com.optionlab.service.ComparisonReport;
import com.optionlab.service.MethodComparison;
import com.optionlab.service.PricingService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for PricingController: request mapping onto domain inputs, response wrapping and
 * error translation for each pricing endpoint.
 */
@ExtendWith(MockitoExtension.class)
class PricingControllerTest {

    private static final String ATM_CALL = """
            {
              "spot": 100,
              "volatility": 0.2,
              "riskFreeRate": 0.05,
              "timeToExpiry": 1.0,
              "payoffKind": "VANILLA_CALL",
              "strike": 100
            }
            """;

    @Mock
    private PricingService pricingService;

    private PricingProperties pricingProperties;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        pricingProperties = new PricingProperties();
        PricingController pricingController =
                new PricingController(
                        pricingService, Mappers.getMapper(PricingRequestMapper.class), pricingProperties);
        mockMvc = MockMvcBuilders.standaloneSetup(pricingController)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("POST /api/pricing/analytic")
    class Analytic {

        @Test
        @DisplayName("Returns the wrapped closed-form result")
        void returnsResult() throws Exception {
            when(pricingService.closedForm(any(), any()))
                    .thenReturn(PricingResult.builder()
                            .method(PricingMethod.CLOSED_FORM)
                            .value(10.4506)
                            .build());

            mockMvc.perform(post("/api/pricing/analytic")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.method").value("CLOSED_FORM"))
                    .andExpect(jsonPath("$.data.value").value(10.4506));

            ArgumentCaptor<MarketParameters> market = ArgumentCaptor.forClass(MarketParameters.class);
            ArgumentCaptor<OptionSpec> spec = ArgumentCaptor.forClass(OptionSpec.class);
            verify(pricingService).closedForm(market.capture(), spec.capture());
            assertThat(market.getValue().getSpot()).isEqualTo(100.0);
            assertThat(market.getValue().getDividendYield()).isZero();
            assertThat(spec.getValue().getExerciseStyle()).isEqualTo(ExerciseStyle.EUROPEAN);
            assertThat(spec.getValue().getStrike()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Missing and invalid market fields return 400 with field details")
        void validationError() throws Exception {
            mockMvc.perform(post("/api/pricing/analytic")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "volatility": -0.2,
                                      "riskFreeRate": 0.05,
                                      "timeToExpiry": 1.0,
                                      "payoffKind": "VANILLA_CALL",
                                      "strike": 100
                                    }
                                    """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.status").value(400))
                    .andExpect(jsonPath("$.error.details.spot").value("spot is required"))
                    .andExpect(jsonPath("$.error.details.volatility").value("volatility must be positive"));

            verifyNoInteractions(pricingService);
        }

        @Test
        @DisplayName("Unknown payoff kind is an unreadable body")
        void unknownPayoffKind() throws Exception {
            mockMvc.perform(post("/api/pricing/analytic")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL.replace("VANILLA_CALL", "BARRIER_CALL")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("Missing strike is an invalid parameter")
        void missingStrike() throws Exception {
            mockMvc.perform(post("/api/pricing/analytic")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL.replace("\"strike\": 100", "\"cashAmount\": 1")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("INVALID_PARAMETER"))
                    .andExpect(jsonPath("$.error.message").value("VANILLA_CALL requires a strike"));

            verifyNoInteractions(pricingService);
        }
    }

    @Nested
    @DisplayName("POST /api/pricing/lattice")
    class Lattice {

        @Test
        @DisplayName("American put returns value and exercise boundary")
        void americanPut() throws Exception {
            OptionSpec americanPut = OptionSpec.american(new VanillaPut(50));
            when(pricingService.lattice(any(), eq(americanPut), eq(LatticeConfig.ofSteps(200))))
                    .thenReturn(PricingResult.builder()
                            .method(PricingMethod.LATTICE)
                            .value(4.28)
                            .steps(200)
                            .exerciseBoundary(List.of(
                                    new ExerciseBoundaryPoint(0.1, 38.5), new ExerciseBoundaryPoint(0.4, 49.1)))
                            .build());

            mockMvc.perform(post("/api/pricing/lattice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "spot": 50,
                                      "volatility": 0.4,
                                      "riskFreeRate": 0.1,
                                      "timeToExpiry": 0.4167,
                                      "exerciseStyle": "AMERICAN",
                                      "payoffKind": "VANILLA_PUT",
                                      "strike": 50,
                                      "latticeSteps": 200
                                    }
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.value").value(4.28))
                    .andExpect(jsonPath("$.data.exerciseBoundary[0].time").value(0.1))
                    .andExpect(jsonPath("$.data.exerciseBoundary[1].price").value(49.1));
        }

        @Test
        @DisplayName("Arbitrage violation returns 422 with the tree parameters")
        void arbitrageViolation() throws Exception {
            when(pricingService.lattice(any(), any(), any()))
                    .thenThrow(new ArbitrageViolationException(
                            "Risk-neutral probability 10.5 outside (0, 1)", Map.of("probability", 10.5)));

            mockMvc.perform(post("/api/pricing/lattice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error.code").value("ARBITRAGE_VIOLATION"))
                    .andExpect(jsonPath("$.error.status").value(422))
                    .andExpect(jsonPath("$.error.details.probability").value(10.5))
                    .andExpect(jsonPath("$.error.path").value("/api/pricing/lattice"));
        }

        @Test
        @DisplayName("Lattice steps default to the configured value")
        void defaultSteps() throws Exception {
            pricingProperties.getLattice().setDefaultSteps(321);
            when(pricingService.lattice(any(), any(), any()))
                    .thenReturn(PricingResult.builder().method(PricingMethod.LATTICE).value(1.0).build());

            mockMvc.perform(post("/api/pricing/lattice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL))
                    .andExpect(status().isOk());

            verify(pricingService).lattice(any(), any(), eq(LatticeConfig.ofSteps(321)));
        }
    }

    @Nested
    @DisplayName("POST /api/pricing/monte-carlo and /pde")
    class MonteCarloAndPde {

        @Test
        @DisplayName("Monte Carlo settings are passed through")
        void monteCarloSettings() throws Exception {
            when(pricingService.monteCarlo(any(), any(), any()))
                    .thenReturn(PricingResult.builder()
                            .method(PricingMethod.MONTE_CARLO)
                            .value(10.43)
                            .standardError(0.046)
                            .seed(42L)
                            .build());

            mockMvc.perform(post("/api/pricing/monte-carlo")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL.replace("\"strike\": 100", """
                                    "strike": 100, "paths": 50000, "simulationSteps": 12, "seed": 42,
                                    "antithetic": true, "tolerance": 0.05""")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.standardError").value(0.046))
                    .andExpect(jsonPath("$.data.seed").value(42));

            ArgumentCaptor<MonteCarloConfig> config = ArgumentCaptor.forClass(MonteCarloConfig.class);
            verify(pricingService).monteCarlo(any(), any(), config.capture());
            assertThat(config.getValue().getPaths()).isEqualTo(50_000);
            assertThat(config.getValue().getSteps()).isEqualTo(12);
            assertThat(config.getValue().getSeed()).isEqualTo(42L);
            assertThat(config.getValue().getTolerance()).isEqualTo(0.05);
            assertThat(config.getValue().isAntithetic()).isTrue();
        }

        @Test
        @DisplayName("Cash-or-nothing window is mapped for the PDE solver")
        void pdeCashOrNothing() throws Exception {
            when(pricingService.finiteDifference(any(), any(), any()))
                    .thenReturn(PricingResult.builder().method(PricingMethod.FINITE_DIFFERENCE).value(2.12).build());

            mockMvc.perform(post("/api/pricing/pde")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "spot": 100,
                                      "volatility": 0.1,
                                      "riskFreeRate": 0.05,
                                      "timeToExpiry": 1.0,
                                      "payoffKind": "CASH_OR_NOTHING",
                                      "lowerBound": 110,
                                      "upperBound": 120,
                                      "cashAmount": 10,
                                      "scheme": "CRANK_NICOLSON",
                                      "priceSteps": 200
                                    }
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.method").value("FINITE_DIFFERENCE"));

            ArgumentCaptor<OptionSpec> spec = ArgumentCaptor.forClass(OptionSpec.class);
            ArgumentCaptor<FiniteDifferenceConfig> config = ArgumentCaptor.forClass(FiniteDifferenceConfig.class);
            verify(pricingService).finiteDifference(any(), spec.capture(), config.capture());
            assertThat(spec.getValue().getPayoff()).isEqualTo(new CashOrNothing(110, 120, 10));
            assertThat(config.getValue().getScheme()).isEqualTo(FiniteDifferenceScheme.CRANK_NICOLSON);
            assertThat(config.getValue().getPriceSteps()).isEqualTo(200);
            assertThat(config.getValue().getTimeSteps()).isEqualTo(400);
        }

        @Test
        @DisplayName("Unstable explicit grid returns 422")
        void pdeUnstable() throws Exception {
            when(pricingService.finiteDifference(any(), any(), any()))
                    .thenThrow(new NumericalInstabilityException(
                            "Explicit scheme unstable", Map.of("stabilityRatio", 158.0)));

            mockMvc.perform(post("/api/pricing/pde")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error.code").value("NUMERICAL_INSTABILITY"))
                    .andExpect(jsonPath("$.error.details.stabilityRatio").value(158.0));
        }
    }

    @Nested
    @DisplayName("POST /api/pricing/compare and /discretization-study")
    class CompareAndStudy {

        @Test
        @DisplayName("Comparison report is returned with its reference")
        void compare() throws Exception {
            when(pricingService.compare(any(), any(), any(), any(), any()))
                    .thenReturn(ComparisonReport.builder()
                            .option(OptionSpec.european(new VanillaCall(100)))
                            .referenceMethod(PricingMethod.CLOSED_FORM)
                            .referenceValue(10.4506)
                            .comparisons(List.of(
                                    new MethodComparison(
                                            PricingMethod.LATTICE,
                                            PricingResult.builder()
                                                    .method(PricingMethod.LATTICE)
                                                    .value(10.4406)
                                                    .steps(500)
                                                    .build(),
                                            -0.01,
                                            null),
                                    new MethodComparison(PricingMethod.MONTE_CARLO, null, null, "disabled")))
                            .build());

            mockMvc.perform(post("/api/pricing/compare")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(ATM_CALL))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.payoffKind").value("VANILLA_CALL"))
                    .andExpect(jsonPath("$.data.exerciseStyle").value("EUROPEAN"))
                    .andExpect(jsonPath("$.data.strike").value(100.0))
                    .andExpect(jsonPath("$.data.referenceMethod").value("CLOSED_FORM"))
                    .andExpect(jsonPath("$.data.referenceValue").value(10.4506))
                    .andExpect(jsonPath("$.data.comparisons[0].skipped").value(false))
                    .andExpect(jsonPath("$.data.comparisons[0].result.steps").value(500))
                    .andExpect(jsonPath("$.data.comparisons[0].differenceFromReference").value(-0.01))
                    .andExpect(jsonPath("$.data.comparisons[1].skipped").value(true))
                    .andExpect(jsonPath("$.data.comparisons[1].skippedReason").value("disabled"));
        }

        @Test
        @DisplayName("Step counts are forwarded in order")
        void discretizationStudy() throws Exception {
            when(pricingService.discretizationStudy(any(), any(), any(), eq(10), eq(50)))
                    .thenReturn(List.of(
                            PricingResult.builder().method(PricingMethod.MONTE_CARLO).value(14.1).steps(10).build(),
                            PricingResult.builder().method(PricingMethod.MONTE_CARLO).value(15.9).steps(50).build()));

            mockMvc.perform(post("/api/pricing/discretization-study")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "option": {
                                        "spot": 100,
                                        "volatility": 0.2,
                                        "riskFreeRate": 0.05,
                                        "timeToExpiry": 1.0,
                                        "payoffKind": "LOOKBACK_CALL",
                                        "strike": 100,
                                        "paths": 10000,
                                        "seed": 7
                                      },
                                      "stepCounts": [10, 50]
                                    }
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.length()").value(2))
                    .andExpect(jsonPath("$.data[1].steps").value(50));
        }

        @Test
        @DisplayName("Nested option is validated")
        void nestedValidation() throws Exception {
            mockMvc.perform(post("/api/pricing/discretization-study")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "option": {"volatility": 0.2, "riskFreeRate": 0.05, "timeToExpiry": 1.0,
                                                 "payoffKind": "LOOKBACK_CALL", "strike": 100},
                                      "stepCounts": [10]
                                    }
                                    """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details['option.spot']").value("spot is required"));

            verifyNoInteractions(pricingService);
        }
    }
}
