package com.securefile.core.process;

import java.util.Objects;

public record OutputChunk(String text) implements RelayItem {

    public OutputChunk {
        Objects.requireNonNull(text, "text");
    }
}
