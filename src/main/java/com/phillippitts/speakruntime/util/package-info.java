/**
 * Small time helpers shared by the registry, the monitor and the coordinator.
 */
package com.phillippitts.speakruntime.util;
