package com.phillippitts.callagent.service.generation;

import com.phillippitts.callagent.exception.GenerationException;

/**
 * Chooses the assistant's reply to a completed caller utterance.
 *
 * <p>Called off the call lane; implementations may block on remote services.
 */
public interface ResponseGenerator {

    /**
     * @throws GenerationException if no usable response could be produced
     */
    GenerationResult generate(GenerationRequest request);
}
