/**
 * In-memory dead-letter and telemetry sinks.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.sink;
