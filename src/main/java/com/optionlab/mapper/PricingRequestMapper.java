package com.optionlab.mapper;

import com.optionlab.api.dto.request.PathSimulationRequest;
import com.optionlab.api.dto.request.PricingRequest;
import com.optionlab.config.PricingProperties;
import com.optionlab.domain.model.FiniteDifferenceConfig;
import com.optionlab.domain.model.LatticeConfig;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.MonteCarloConfig;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.payoff.Payoff;
import com.optionlab.payoff.PayoffFactory;
import com.optionlab.payoff.PayoffParameters;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from request DTOs to validated domain inputs.
 *
 * <p>Unset method settings are filled from the {@link PricingProperties} passed as context; the
 * PDE grid width and snapshot count always come from there. Domain constructors reject anything
 * the bean validation annotations let through, so mapping can throw
 * {@link com.optionlab.exception.InvalidParameterException}.
 */
@Mapper(componentModel = "spring")
public interface PricingRequestMapper {

    MarketParameters toMarket(PricingRequest request);

    MarketParameters toMarket(PathSimulationRequest request);

    @Mapping(target = "payoff", expression = "java(toPayoff(request))")
    OptionSpec toOptionSpec(PricingRequest request);

    @Mapping(source = "cashAmount", target = "amount")
    PayoffParameters toPayoffParameters(PricingRequest request);

    @Mapping(
            target = "steps",
            expression =
                    "java(request.getLatticeSteps() != null ? request.getLatticeSteps()"
                            + " : defaults.getLattice().getDefaultSteps())")
    LatticeConfig toLatticeConfig(PricingRequest request, @Context PricingProperties defaults);

    @Mapping(
            target = "steps",
            expression =
                    "java(request.getSimulationSteps() != null ? request.getSimulationSteps()"
                            + " : defaults.getMonteCarlo().getDefaultSteps())")
    @Mapping(
            target = "paths",
            expression =
                    "java(request.getPaths() != null ? request.getPaths()"
                            + " : defaults.getMonteCarlo().getDefaultPaths())")
    MonteCarloConfig toMonteCarloConfig(PricingRequest request, @Context PricingProperties defaults);

    @Mapping(
            target = "priceSteps",
            expression =
                    "java(request.getPriceSteps() != null ? request.getPriceSteps()"
                            + " : defaults.getFiniteDifference().getPriceSteps())")
    @Mapping(
            target = "timeSteps",
            expression =
                    "java(request.getTimeSteps() != null ? request.getTimeSteps()"
                            + " : defaults.getFiniteDifference().getTimeSteps())")
    @Mapping(
            target = "scheme",
            expression =
                    "java(request.getScheme() != null ? request.getScheme()"
                            + " : defaults.getFiniteDifference().getScheme())")
    @Mapping(target = "widthInStdDevs", expression = "java(defaults.getFiniteDifference().getWidthInStdDevs())")
    @Mapping(target = "snapshotCount", expression = "java(defaults.getFiniteDifference().getSnapshotCount())")
    FiniteDifferenceConfig toFiniteDifferenceConfig(PricingRequest request, @Context PricingProperties defaults);

    /** Builds the payoff variant for the requested kind; missing parameters are rejected here. */
    default Payoff toPayoff(PricingRequest request) {
        return PayoffFactory.create(request.getPayoffKind(), toPayoffParameters(request));
    }
}
