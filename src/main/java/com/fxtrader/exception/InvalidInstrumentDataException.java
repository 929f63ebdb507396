package com.fxtrader.exception;

/** Instrument reference data is missing or unusable (unknown symbol, zero point size). */
public class InvalidInstrumentDataException extends BaseException {

    public InvalidInstrumentDataException(String symbol, String problem) {
        super(ErrorCode.INVALID_INSTRUMENT_DATA, String.format("Invalid instrument data for %s: %s", symbol, problem));
    }
}
