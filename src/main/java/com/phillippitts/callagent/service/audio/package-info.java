/**
 * Telephony audio utilities: format constants, G.711 mu-law codec, PCM resampling and WAV output.
 *
 * <p>All helpers are stateless and thread-safe.
 *
 * @since 1.0
 */
package com.phillippitts.callagent.service.audio;
