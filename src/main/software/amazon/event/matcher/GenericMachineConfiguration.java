package software.amazon.event.matcher;

/**
 * Configuration for a GenericMachine. For descriptions of the options, see GenericMachine.Builder.
 */
class GenericMachineConfiguration {

    private final int maximumPatternSize;
    private final boolean pathOverriding;

    GenericMachineConfiguration(int maximumPatternSize, boolean pathOverriding) {
        this.maximumPatternSize = maximumPatternSize;
        this.pathOverriding = pathOverriding;
    }

    int getMaximumPatternSize() {
        return maximumPatternSize;
    }

    boolean isPathOverriding() {
        return pathOverriding;
    }

    @Override
    public String toString() {
        return "maximumPatternSize=" + maximumPatternSize + ", pathOverriding=" + pathOverriding;
    }
}
