/**
 * Child-safety event recording, emergency escalation, sliding-window pattern
 * detection and per-child safety scoring.
 *
 * @since 1.0.0
 */
package com.safetysentinel.core.safety;
