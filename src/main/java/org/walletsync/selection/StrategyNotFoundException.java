package org.walletsync.selection;

@SuppressWarnings("serial")
public class StrategyNotFoundException extends RuntimeException {

    public StrategyNotFoundException(String strategyId) {
        super(String.format("No selection strategy registered as \"%s\"", strategyId));
    }

}
