package com.bondtrader.domain.model;

import java.util.List;
import lombok.Value;

/** A named group of instruments that risk could be bucketed into. */
@Value
public class BucketedSector {

    String name;
    List<Instrument> instruments;

    public BucketedSector(String name, List<Instrument> instruments) {
        this.name = name;
        this.instruments = List.copyOf(instruments);
    }
}
