/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.watchkeeper.exception.WatchkeeperException} - Base exception</li>
 *   <li>{@link com.phillippitts.watchkeeper.exception.GateBusyException} - Another exclusive
 *       command holds the gate; retry later</li>
 *   <li>{@link com.phillippitts.watchkeeper.exception.SpawnException} - A process could not be
 *       started; retried per slot, then reported as degraded status</li>
 *   <li>{@link com.phillippitts.watchkeeper.exception.RegistrationConflictException} - Descriptor
 *       already bound in the handler ledger</li>
 *   <li>{@link com.phillippitts.watchkeeper.exception.LedgerDivergenceException} - Ledger and
 *       event loop irreconcilable; daemon-level fatal</li>
 *   <li>{@link com.phillippitts.watchkeeper.exception.UnknownWatcherException} - Command names
 *       a watcher that does not exist</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, carry their context fields (watcher name, descriptor,
 * active command) and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.watchkeeper.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.watchkeeper.exception;
