/**
 * REST controllers.
 *
 * <p>{@link com.phillippitts.callagent.presentation.controller.CallStatusController} exposes
 * {@code GET /calls}, {@code GET /calls/{callId}}, {@code GET /calls/library} and
 * {@code GET /calls/profiles/{phoneNumber}}. Exceptions are mapped by
 * {@code GlobalExceptionHandler}.
 */
package com.phillippitts.callagent.presentation.controller;
