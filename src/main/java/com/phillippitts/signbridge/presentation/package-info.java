/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on the service layer, never the reverse. The pipeline and
 * caches run the same with or without HTTP in front of them.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - operational REST endpoints</li>
 *   <li>{@code presentation.exception} - exception to HTTP status mapping</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.signbridge.presentation;
