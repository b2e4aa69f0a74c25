package com.star.eximscanner.exception;

import lombok.Getter;

/**
 * Raised when a parser is asked for something its grammar does not define.
 * This is a contract violation by the caller, not bad input.
 */
@Getter
public class UnableToParseFileException extends LogProcessingException {

    private final String structureKey;

    public UnableToParseFileException(String message) {
        super(message);
        this.structureKey = null;
    }

    public UnableToParseFileException(String structureKey, String message) {
        super(message);
        this.structureKey = structureKey;
    }

    public static UnableToParseFileException unsupportedKey(String structureKey) {
        return new UnableToParseFileException(
                structureKey,
                String.format("Unsupported key: %s", structureKey)
        );
    }
}
