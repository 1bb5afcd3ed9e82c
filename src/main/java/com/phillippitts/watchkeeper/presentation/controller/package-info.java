/**
 * REST API controllers for the control protocol.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.watchkeeper.presentation.controller.WatcherController}
 *       - {@code /watchers}: status, add/remove, and per-watcher start, stop, restart, incr, decr</li>
 *   <li>{@link com.phillippitts.watchkeeper.presentation.controller.DaemonController}
 *       - {@code /daemon}: start-all, stop-all, reload, reap, quit</li>
 * </ul>
 *
 * <p>Controllers only delegate to
 * {@link com.phillippitts.watchkeeper.service.control.SupervisorCommands}; exceptions are left to
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.watchkeeper.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.watchkeeper.presentation.controller;
