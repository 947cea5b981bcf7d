/**
 * LedgerRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ledgerrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.ledgerrelay.cli.LedgerRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.ledgerrelay.watcher.LedgerWatcher} turns the Horizon feed into broker events.</li>
 *   <li>{@code io.ledgerrelay.runtime.TaskRunner} runs deliveries on the worker pool.</li>
 *   <li>{@code io.ledgerrelay.storage.TaskStore} is the authoritative task state.</li>
 * </ul>
 */
package io.ledgerrelay;
