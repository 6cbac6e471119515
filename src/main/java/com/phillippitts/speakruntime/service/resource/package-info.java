/**
 * Resource registry: registration with dependencies, state machine, dependency-ordered
 * initialization and dependents-first disposal.
 */
package com.phillippitts.speakruntime.service.resource;
