/**
 * Composition root.
 *
 * <p>{@link io.taskloom.runtime.TaskloomRuntime} builds the queue, supervisor, coordinator and
 * controller from one data root and exposes the views and maintenance operations the CLI uses.
 */
package io.taskloom.runtime;
