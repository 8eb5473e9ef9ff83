package com.bondtrader.domain;

import com.bondtrader.domain.model.Instrument;
import com.bondtrader.exception.UnknownInstrumentException;
import java.util.List;
import java.util.Optional;

/** Static set of instruments the pipeline knows about. */
public interface InstrumentCatalog {

    /** All instruments in catalog order. */
    List<Instrument> getInstruments();

    Optional<Instrument> find(String instrumentId);

    /**
     * Returns the instrument for the id or throws {@link UnknownInstrumentException}.
     */
    default Instrument require(String instrumentId) {
        return find(instrumentId).orElseThrow(() -> new UnknownInstrumentException(instrumentId));
    }

    default boolean contains(String instrumentId) {
        return find(instrumentId).isPresent();
    }
}
