/**
 * WebSocket transport for telephony media streams.
 */
package com.phillippitts.callagent.presentation.websocket;
