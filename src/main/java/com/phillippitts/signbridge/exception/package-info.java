/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.signbridge.exception.SignBridgeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.signbridge.exception.MediationException} - The external
 *       mediation operation failed or returned invalid data</li>
 *   <li>{@link com.phillippitts.signbridge.exception.MediationTimeoutException} - Mediation
 *       exceeded its configured timeout</li>
 *   <li>{@link com.phillippitts.signbridge.exception.PersistenceException} - The durable
 *       cache store could not be read or written</li>
 *   <li>{@link com.phillippitts.signbridge.exception.CacheDeserializationException} - A
 *       persisted cache blob was corrupt</li>
 * </ul>
 *
 * <p>Cache misses are not exceptions. Mediation and persistence failures are recovered
 * locally (fallback output, memory-only caching) and never reach the end user.
 *
 * @see com.phillippitts.signbridge.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.signbridge.exception;
