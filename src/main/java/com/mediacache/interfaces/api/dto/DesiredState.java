package com.mediacache.interfaces.api.dto;

/**
 * What the media catalog wants for a title.
 */
public enum DesiredState {
    CACHED,
    RELEASED
}
