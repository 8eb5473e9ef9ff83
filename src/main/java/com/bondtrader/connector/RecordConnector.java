package com.bondtrader.connector;

/**
 * Outbound side of a stage: receives values the stage wants written somewhere.
 *
 * @param <V> the published value type
 */
@FunctionalInterface
public interface RecordConnector<V> {

    void publish(V data);
}
