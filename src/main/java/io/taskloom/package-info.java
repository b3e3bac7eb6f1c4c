/**
 * Taskloom source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskloom.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskloom.cli.TaskloomCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.taskloom.loop.WorkLoopController} is the long-running control loop.</li>
 *   <li>{@code io.taskloom.storage.WorkQueue} is the durable task queue.</li>
 * </ul>
 */
package io.taskloom;
