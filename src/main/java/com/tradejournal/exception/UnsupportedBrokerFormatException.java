package com.tradejournal.exception;

import java.util.Collection;
import java.util.Map;

public class UnsupportedBrokerFormatException extends BaseException {

    public UnsupportedBrokerFormatException(Collection<String> headers) {
        super(
                ErrorCode.UNSUPPORTED_FORMAT,
                "Unrecognised export format: no supported broker header set found",
                Map.of("headers", String.join(",", headers)));
    }
}
