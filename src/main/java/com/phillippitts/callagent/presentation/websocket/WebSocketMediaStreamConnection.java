package com.phillippitts.callagent.presentation.websocket;

import com.phillippitts.callagent.exception.TransportException;
import com.phillippitts.callagent.service.streaming.MediaStreamConnection;
import com.phillippitts.callagent.service.streaming.MediaStreamFrames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link MediaStreamConnection} over a Spring WebSocket session speaking the Twilio Media Streams
 * protocol. Sends from several threads are serialized by a
 * {@link ConcurrentWebSocketSessionDecorator}.
 */
public class WebSocketMediaStreamConnection implements MediaStreamConnection {

    private static final Logger LOG = LogManager.getLogger(WebSocketMediaStreamConnection.class);

    static final int SEND_TIME_LIMIT_MS = 5000;
    static final int BUFFER_SIZE_LIMIT_BYTES = 512 * 1024;

    private final WebSocketSession session;
    private final String callId;

    public WebSocketMediaStreamConnection(WebSocketSession session, String callId) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT_BYTES);
        this.callId = callId;
    }

    @Override
    public void sendMedia(String streamSid, byte[] ulaw) {
        send(MediaStreamFrames.media(streamSid, ulaw));
    }

    @Override
    public void sendClear(String streamSid) {
        send(MediaStreamFrames.clear(streamSid));
    }

    @Override
    public void sendStop(String streamSid) {
        send(MediaStreamFrames.stop(streamSid));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            LOG.debug("Error closing media stream for call {}: {}", callId, e.getMessage());
        }
    }

    private void send(String frame) {
        if (!session.isOpen()) {
            throw new TransportException("Media stream is closed", callId);
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (SessionLimitExceededException e) {
            throw new TransportException("Media stream send limit exceeded", callId, e);
        } catch (IOException e) {
            throw new TransportException("Media stream send failed", callId, e);
        }
    }
}
