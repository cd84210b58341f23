/**
 * Runtime orchestration package.
 *
 * <p>{@link io.sqlrpc.runtime.TaskManager} owns the task lifecycle: readiness checks, creation,
 * kills and metrics. {@link io.sqlrpc.runtime.ReloadController} owns the compiled project graph and is the
 * only writer of the reference tasks capture at creation.
 */
package io.sqlrpc.runtime;
