package com.infomedia.abacox.storemigration.component.staging;

public class CorruptPayloadException extends RuntimeException {

    private final long naturalId;

    public CorruptPayloadException(EntityKind kind, long naturalId, Throwable cause) {
        super("Stored " + kind + " payload for id " + naturalId + " is not valid JSON", cause);
        this.naturalId = naturalId;
    }

    public long getNaturalId() {
        return naturalId;
    }
}
