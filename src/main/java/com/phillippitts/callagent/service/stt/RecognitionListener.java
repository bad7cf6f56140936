package com.phillippitts.callagent.service.stt;

import com.phillippitts.callagent.domain.TranscriptFragment;
import com.phillippitts.callagent.exception.RecognitionException;

/**
 * Callback for recognizer output.
 */
public interface RecognitionListener {

    void onFragment(TranscriptFragment fragment);

    void onError(RecognitionException error);
}
