package com.bondtrader.event;

import com.bondtrader.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for every pipeline stage: the latest value per key plus an ordered list of
 * listeners.
 *
 * <p>Subclasses define their own ingestion entry point (e.g. {@code addTrade},
 * {@code execute}) which updates state through {@link #put} and then calls
 * {@link #notifyListeners}. Notification is synchronous and depth-first: each listener
 * runs to completion, including whatever it forwards into downstream stages, before the
 * next listener is called. There is no error isolation; an exception from a listener
 * propagates to whoever called the ingestion method and the remaining listeners are not
 * invoked.
 *
 * <p>Not thread-safe. A stage is owned and driven by a single thread.
 *
 * @param <K> key type (instrument id, trade id, inquiry id, ...)
 * @param <V> value type held and published
 */
public abstract class KeyedService<K, V> {

    private static final Logger log = LoggerFactory.getLogger(KeyedService.class);

    private final Map<K, V> data = new LinkedHashMap<>();
    private final List<ServiceListener<V>> listeners = new ArrayList<>();

    /** Human readable stage name, used in logs and NotFound messages. */
    public abstract String getName();

    /**
     * Latest value for {@code key}.
     *
     * @throws ResourceNotFoundException if nothing has been stored under the key
     */
    public V getData(K key) {
        V value = data.get(key);
        if (value == null) {
            throw new ResourceNotFoundException(getName(), key);
        }
        return value;
    }

    public Optional<V> findData(K key) {
        return Optional.ofNullable(data.get(key));
    }

    public boolean contains(K key) {
        return data.containsKey(key);
    }

    public int size() {
        return data.size();
    }

    /** Read-only view of all keys in first-insertion order. */
    public List<K> getKeys() {
        return List.copyOf(data.keySet());
    }

    /** Appends a listener; notification order is registration order. */
    public void addListener(ServiceListener<V> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        log.debug("{}: registered listener #{}", getName(), listeners.size());
    }

    public List<ServiceListener<V>> getListeners() {
        return Collections.unmodifiableList(listeners);
    }

    protected void put(K key, V value) {
        data.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    protected V remove(K key) {
        return data.remove(key);
    }

    protected void notifyListeners(V value) {
        dispatch(listener -> listener.processAdd(value));
    }

    protected void notifyRemoved(V value) {
        dispatch(listener -> listener.processRemove(value));
    }

    protected void notifyUpdated(V value) {
        dispatch(listener -> listener.processUpdate(value));
    }

    private void dispatch(Consumer<ServiceListener<V>> callback) {
        for (ServiceListener<V> listener : listeners) {
            callback.accept(listener);
        }
    }
}
