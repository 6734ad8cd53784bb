/**
 * Bounded FIFO storage used by all metric and event stores.
 */
package com.safetysentinel.core.buffer;
