package com.example.ingestionservice.resolver;

import java.util.Optional;

/**
 * Authoritative, network-backed identity lookup.
 * 
 * Returns empty when the upstream answered but has no value for the id
 * (e.g. 404). Throws when the call itself failed, so the caller can retry.
 */
public interface IdentityLookup {

    Optional<String> lookup(IdentityKind kind, String rawId);
}
