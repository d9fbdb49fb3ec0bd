package com.phillippitts.enginecoordinator.domain;

import java.util.Objects;

/**
 * One error entry of a coordination result.
 *
 * @param engine  engine that produced the error
 * @param kind    taxonomy entry
 * @param message technical diagnostic; never contains prompt text
 */
public record EngineError(EngineType engine, ErrorKind kind, String message) {

    public EngineError {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(kind, "kind");
        if (message == null) {
            message = "";
        }
    }
}
