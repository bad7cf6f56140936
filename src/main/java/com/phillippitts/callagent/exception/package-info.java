/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so the call orchestrator can
 * separate fatal failures from recoverable ones at a single boundary.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.callagent.exception.CallAgentException} - Base exception</li>
 *   <li>{@link com.phillippitts.callagent.exception.TransportException} - Media-stream connection
 *       lost; ends the call</li>
 *   <li>{@link com.phillippitts.callagent.exception.RecognitionException} - Streaming recognizer
 *       failure; logged, the call continues without transcripts</li>
 *   <li>{@link com.phillippitts.callagent.exception.GenerationException} and
 *       {@link com.phillippitts.callagent.exception.SynthesisException} - Recovered by playing an
 *       apology</li>
 *   <li>{@link com.phillippitts.callagent.exception.RecordingException} - Isolated to the recording
 *       finalization worker</li>
 *   <li>{@link com.phillippitts.callagent.exception.ProfileNotFoundException} - Strict profile lookup
 *       miss</li>
 * </ul>
 *
 * @see com.phillippitts.callagent.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.callagent.exception;
