package com.fintech.candlesync.source;

/**
 * Thrown when an instrument cannot be mapped to any symbol offered by the provider.
 */
public class InstrumentNotFoundException extends SourceException {

    private final String instrument;

    public InstrumentNotFoundException(String instrument) {
        super(SourceErrorKind.NOT_FOUND, "Instrument not available from source: " + instrument);
        this.instrument = instrument;
    }

    public String instrument() {
        return instrument;
    }
}
