/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@code IllegalArgumentException}, bean validation failures, unreadable bodies → 400</li>
 *   <li>{@code UnsupportedOperationException} (write to the emergency table) → 409</li>
 *   <li>{@link com.phillippitts.signbridge.exception.SignBridgeException} → 503</li>
 *   <li>{@code Exception} (catch-all) → 500</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidRequest",
 *   "message": "Invalid request",
 *   "details": "Unknown mode: sideways",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.signbridge.presentation.exception;
