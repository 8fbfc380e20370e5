package net.pedegie.atomics.longs;

import java.util.Objects;

class SpinWaitConfigurationValidator
{
    private static final String EXCEPTION_HEADER = "Wrong configuration of " + SpinWaitConfiguration.class.getName() + "\n";

    public static void validate(SpinWaitConfiguration configuration)
    {
        Objects.requireNonNull(configuration, "configuration");

        if (configuration.getSpinIterationsBeforeYield() < 0)
        {
            throw new IllegalArgumentException(EXCEPTION_HEADER + "spinIterationsBeforeYield: " + configuration.getSpinIterationsBeforeYield() + " cannot be negative");
        }

        if (configuration.getMaxSpinsPerIteration() < 1)
            throw new IllegalArgumentException(EXCEPTION_HEADER + "maxSpinsPerIteration: " + configuration.getMaxSpinsPerIteration() + " cannot be less than 1");

        if (configuration.getContentionLogThreshold() < 1)
            throw new IllegalArgumentException(EXCEPTION_HEADER + "contentionLogThreshold: " + configuration.getContentionLogThreshold() + " cannot be less than 1");
    }
}
