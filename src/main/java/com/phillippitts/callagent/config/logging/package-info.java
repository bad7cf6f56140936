/**
 * Logging support: request and call correlation through the Log4j2 ThreadContext.
 */
package com.phillippitts.callagent.config.logging;
