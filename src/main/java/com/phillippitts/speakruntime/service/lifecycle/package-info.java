/**
 * Application lifecycle coordination.
 *
 * <p>{@link com.phillippitts.speakruntime.service.lifecycle.LifecycleCoordinator} turns
 * {@link com.phillippitts.speakruntime.domain.LifecycleEvent}s into phase transitions and drives the
 * resource registry and memory monitor accordingly. Registered
 * {@link com.phillippitts.speakruntime.service.lifecycle.ServiceLifecycle} callbacks are notified
 * before each transition runs. State summaries are persisted through a
 * {@link com.phillippitts.speakruntime.service.lifecycle.SnapshotStore}.
 */
package com.phillippitts.speakruntime.service.lifecycle;
