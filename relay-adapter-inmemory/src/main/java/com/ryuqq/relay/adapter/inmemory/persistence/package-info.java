/**
 * In-memory saga checkpoint persistence.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.persistence;
