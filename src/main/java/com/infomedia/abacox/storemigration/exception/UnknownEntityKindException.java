package com.infomedia.abacox.storemigration.exception;

public class UnknownEntityKindException extends RuntimeException {

    public UnknownEntityKindException(String value) {
        super("Unknown entity kind: " + value);
    }
}
