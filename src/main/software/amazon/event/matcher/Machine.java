package software.amazon.event.matcher;

/**
 *  A GenericMachine whose patterns are named by Strings. See GenericMachine for the concurrency strategy.
 */
public class Machine extends GenericMachine<String> {

    public Machine() {
    }
}
