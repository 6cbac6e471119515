/**
 * Value types shared by the resource registry, the memory monitor and the lifecycle
 * coordinator: resource kinds and states, resource views, lifecycle phases and events,
 * pressure levels, memory samples and tracked allocations.
 *
 * <p>All records are immutable and safe to hand across threads.
 *
 * @since 1.0
 */
package com.phillippitts.speakruntime.domain;
