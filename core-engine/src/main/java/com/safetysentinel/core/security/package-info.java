/**
 * Security event recording and failed-authentication escalation.
 *
 * @since 1.0.0
 */
package com.safetysentinel.core.security;
