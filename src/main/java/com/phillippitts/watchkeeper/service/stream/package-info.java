/**
 * Child output streaming and the descriptor binding ledger.
 *
 * <p>{@link com.phillippitts.watchkeeper.service.stream.OutputRedirector} is the only client of
 * {@link com.phillippitts.watchkeeper.service.stream.HandlerRegistry}, which is the only client of
 * the mutating {@link com.phillippitts.watchkeeper.service.stream.IoEventLoop} methods.
 */
package com.phillippitts.watchkeeper.service.stream;
