/**
 * Immutable domain snapshots exposed to collaborators.
 *
 * <p>These types are what the control API, health indicator and logs read. They are produced
 * by {@link com.phillippitts.watchkeeper.service.watcher.Watcher} on each transition and never
 * mutated afterwards.
 *
 * <ul>
 *   <li>{@link com.phillippitts.watchkeeper.domain.WatcherState} - lifecycle states</li>
 *   <li>{@link com.phillippitts.watchkeeper.domain.WatcherStatus} - per-watcher snapshot</li>
 *   <li>{@link com.phillippitts.watchkeeper.domain.ProcessInfo} - per-process snapshot</li>
 * </ul>
 */
package com.phillippitts.watchkeeper.domain;
