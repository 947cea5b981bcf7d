/**
 * Process-level orchestration.
 *
 * <p>{@link io.ledgerrelay.runtime.LedgerRelayRuntime} wires one data root and owns settings
 * reload; {@link io.ledgerrelay.runtime.TaskRunner} and
 * {@link io.ledgerrelay.runtime.BeatScheduler} are the worker and beat loops.
 */
package io.ledgerrelay.runtime;
