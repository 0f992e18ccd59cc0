package com.infomedia.abacox.storemigration.db.entity;

public enum MigrationStatus {
    PENDING,
    SUCCESS,
    FAILED
}
