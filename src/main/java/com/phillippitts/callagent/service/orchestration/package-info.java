/**
 * Per-call orchestration: the call state machine, serial call lanes and the orchestrator that
 * ties recognition, turn detection, response generation, synthesis, streaming and recording
 * together for one call.
 */
package com.phillippitts.callagent.service.orchestration;
