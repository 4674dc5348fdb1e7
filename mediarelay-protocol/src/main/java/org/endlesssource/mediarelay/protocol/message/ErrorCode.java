package org.endlesssource.mediarelay.protocol.message;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum ErrorCode {
    AUTHENTICATION_FAILED,
    PROTOCOL_ERROR,
    SLOW_CONSUMER,
    SHUTTING_DOWN,
    @JsonEnumDefaultValue
    UNKNOWN
}
