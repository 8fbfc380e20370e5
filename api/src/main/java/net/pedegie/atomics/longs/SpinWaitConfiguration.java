package net.pedegie.atomics.longs;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.With;
import lombok.experimental.FieldDefaults;

@Builder
@Getter
@ToString
@FieldDefaults(makeFinal = true, level = AccessLevel.PRIVATE)
@With
public class SpinWaitConfiguration
{
    private static final SpinWaitConfiguration DEFAULT = SpinWaitConfiguration.builder().build();

    @Builder.Default
    int spinIterationsBeforeYield = 10;
    @Builder.Default
    int maxSpinsPerIteration = 1024;
    @Builder.Default
    int contentionLogThreshold = 1000;

    public static SpinWaitConfiguration defaultConfiguration()
    {
        return DEFAULT;
    }
}
