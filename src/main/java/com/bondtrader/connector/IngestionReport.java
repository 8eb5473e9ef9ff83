package com.bondtrader.connector;

import lombok.Value;

/** Line counts from one pass over an input file. */
@Value
public class IngestionReport {

    String source;
    long linesRead;
    long accepted;
    long rejected;

    public static IngestionReport skipped(String source) {
        return new IngestionReport(source, 0, 0, 0);
    }
}
