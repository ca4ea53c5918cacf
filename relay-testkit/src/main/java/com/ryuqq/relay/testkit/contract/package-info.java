/**
 * Adapter contract tests.
 *
 * <p>Each abstract class defines the behaviour an SPI adapter must honour. Adapter modules
 * subclass them in their own test sources and provide the instance under test.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.testkit.contract;
