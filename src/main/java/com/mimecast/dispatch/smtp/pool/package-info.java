/**
 * Bounded connection pool with idle and lifetime eviction and background health checks.
 */
package com.mimecast.dispatch.smtp.pool;
