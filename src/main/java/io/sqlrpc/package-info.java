/**
 * sqlrpc source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sqlrpc.Main} bootstraps the CLI process, for both the server and its workers.</li>
 *   <li>{@code io.sqlrpc.rpc.RpcDispatcher} maps JSON-RPC methods to the task manager.</li>
 *   <li>{@code io.sqlrpc.runtime.TaskManager} creates, tracks and kills tasks.</li>
 *   <li>{@code io.sqlrpc.executor.TaskExecutor} runs each task in its own worker process.</li>
 *   <li>{@code io.sqlrpc.runtime.ReloadController} recompiles and swaps the project graph.</li>
 * </ul>
 */
package io.sqlrpc;
