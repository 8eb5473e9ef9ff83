package com.bondtrader.historical;

import com.bondtrader.connector.RecordConnector;
import com.bondtrader.event.KeyedService;
import java.util.function.Function;

/**
 * Keeps the latest snapshot per key of some upstream stage's output and writes every
 * snapshot to an append-only record connector.
 *
 * @param <V> persisted value type
 */
public class HistoricalDataService<V> extends KeyedService<String, V> {

    private final String name;
    private final RecordConnector<V> connector;
    private final Function<V, String> keyFunction;

    public HistoricalDataService(String name, RecordConnector<V> connector, Function<V, String> keyFunction) {
        this.name = name;
        this.connector = connector;
        this.keyFunction = keyFunction;
    }

    @Override
    public String getName() {
        return name;
    }

    public void persistData(String persistKey, V data) {
        put(persistKey, data);
        connector.publish(data);
        notifyListeners(data);
    }

    /** Persists under the key derived from the value; this is what upstream stages call. */
    public void persist(V data) {
        persistData(keyFunction.apply(data), data);
    }
}
