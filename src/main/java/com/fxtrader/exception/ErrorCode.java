package com.fxtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    NOT_CONNECTED("NOT_CONNECTED", true),
    NOT_FOUND("NOT_FOUND", false),
    INSUFFICIENT_MARGIN("INSUFFICIENT_MARGIN", true),
    INVALID_INSTRUMENT_DATA("INVALID_INSTRUMENT_DATA", false),
    SIZING_REJECTED("SIZING_REJECTED", true),
    VENUE_REJECTION("VENUE_REJECTION", true),
    BROKER_ERROR("BROKER_ERROR", true),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;

    /** Whether a later cycle may succeed without operator action. */
    private final boolean transientFailure;
}
