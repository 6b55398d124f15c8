package com.codeheadsystems.lockbox.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code GET /vault} response and {@code POST /vault} request. The blob is null when
 * nothing has been stored yet.
 *
 * @param blob the blob
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VaultEnvelope(@JsonProperty("blob") VaultBlob blob) {
}
