package io.github.jakubt4.atlas.model;

public enum ProviderCallState {
    NOT_ATTEMPTED,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED
}
