package com.mediacache.domain.model;

public enum Permission {
    READ,
    WRITE,
    DELETE,
    ADMIN
}
