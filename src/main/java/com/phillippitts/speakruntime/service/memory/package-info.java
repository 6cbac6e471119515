/**
 * Memory sampling, pressure classification, cleanup orchestration and leak tracking.
 */
package com.phillippitts.speakruntime.service.memory;
