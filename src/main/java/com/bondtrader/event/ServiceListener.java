package com.bondtrader.event;

/**
 * Callback registered on a {@link KeyedService} to receive its notifications.
 *
 * <p>Only {@link #processAdd} is wired anywhere in the pipeline, so it is the single
 * abstract method and stage-to-stage glue can be written as a method reference, e.g.
 * {@code positionService.addListener(riskService::addPosition)}. Remove and update default
 * to no-ops.
 *
 * @param <V> the event value type
 */
@FunctionalInterface
public interface ServiceListener<V> {

    void processAdd(V data);

    default void processRemove(V data) {}

    default void processUpdate(V data) {}
}
