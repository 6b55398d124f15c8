package com.codeheadsystems.lockbox.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body, for example on {@code 429 Too Many Requests}.
 *
 * @param detail human readable detail
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorDetail(@JsonProperty("detail") String detail) {
}
