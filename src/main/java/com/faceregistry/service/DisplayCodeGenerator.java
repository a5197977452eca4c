package com.faceregistry.service;

import java.time.LocalDateTime;

/**
 * Produces human-readable identity codes of the form {@code PREFIX_yyyyMMdd_HHmm_NNNN}.
 * Implementations decide how the trailing disambiguator is picked.
 */
public interface DisplayCodeGenerator {

    String generate(LocalDateTime createdAt);
}
