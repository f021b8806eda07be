/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/pipeline/input} - run one pipeline cycle</li>
 *   <li>{@code GET /api/pipeline/status} - current status, cycle id, processing flag and recent history</li>
 *   <li>{@code POST /api/pipeline/cancel} - abandon the cycle in flight</li>
 *   <li>{@code GET /api/cache/metrics}, {@code PUT /api/cache/animation}, {@code DELETE /api/cache}</li>
 *   <li>{@code POST /api/phrases/medical}, {@code GET /api/phrases/stats}</li>
 *   <li>{@code GET /api/avatar/idle} - idle state of the avatar</li>
 * </ul>
 *
 * @see com.phillippitts.signbridge.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.signbridge.presentation.controller;
