/**
 * Autoscaling worker pool with a bounded queue and per-task handles.
 *
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.service.pool;
