package com.example.ingestionservice.resolver;

public enum ResolutionPath {
    /** Key found in the record's own text, no network call. */
    FAST,
    /** Key obtained from the authoritative lookup (possibly cached). */
    AUTHORITATIVE,
    /** No resolution performed: the record carries its own key, or nothing was found. */
    NONE
}
