/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.callagent.exception.ProfileNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.callagent.exception.CallAgentException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Stack traces and internal details are never returned to clients; they are logged
 * server-side.
 */
package com.phillippitts.callagent.presentation.exception;
