package com.sitepulse.scribe.service.document;

import java.util.Optional;

/**
 * One way of pulling text out of an uploaded document.
 *
 * Implementations may throw; the chain treats an exception the same as an empty result.
 */
public interface DocumentTextStrategy {

    String name();

    Optional<String> extract(byte[] document) throws Exception;
}
