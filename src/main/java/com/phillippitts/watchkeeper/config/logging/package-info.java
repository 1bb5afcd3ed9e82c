/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP control request</li>
 *   <li>{@code command} - Exclusive command currently held by the logging thread
 *       (set by {@link com.phillippitts.watchkeeper.service.gate.ExclusiveCommandGate})</li>
 *   <li>{@code watcher} - Watcher being mutated, also copied onto its output pump threads</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [control-loop-1] [reconcile] [web] INFO  c.p.w.s.watcher.Watcher - message
 * </pre>
 *
 * @see com.phillippitts.watchkeeper.config.logging.MdcFilter
 */
package com.phillippitts.watchkeeper.config.logging;
