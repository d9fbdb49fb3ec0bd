/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.enginecoordinator.config.logging.MdcFilter} puts a
 * {@code requestId} into the Log4j2 ThreadContext for every HTTP request. The coordinator adds
 * {@code taskId} and {@code taskKind}, and the executors copy the context onto worker threads.
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 INFO  [dispatch-3] [req=9f1c...] [task=4be2... COMPOSITE] logger.name - message
 * </pre>
 *
 * @see com.phillippitts.enginecoordinator.config.ThreadPoolConfig
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.config.logging;
