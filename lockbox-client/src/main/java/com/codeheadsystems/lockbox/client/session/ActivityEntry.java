package com.codeheadsystems.lockbox.client.session;

import java.time.Instant;

/**
 * One activity log line.
 *
 * @param timestamp when it happened
 * @param username  the account
 * @param event     what happened
 */
public record ActivityEntry(Instant timestamp, String username, ActivityEvent event) {
}
