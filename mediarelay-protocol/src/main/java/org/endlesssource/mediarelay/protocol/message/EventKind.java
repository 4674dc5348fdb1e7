package org.endlesssource.mediarelay.protocol.message;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum EventKind {
    PLAYER_APPEARED,
    STATE_CHANGED,
    PLAYER_DISAPPEARED,
    @JsonEnumDefaultValue
    UNKNOWN
}
