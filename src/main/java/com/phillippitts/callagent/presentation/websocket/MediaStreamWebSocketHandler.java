package com.phillippitts.callagent.presentation.websocket;

import com.phillippitts.callagent.domain.CallDirection;
import com.phillippitts.callagent.service.orchestration.CallOrchestrator;
import com.phillippitts.callagent.service.orchestration.CallOrchestratorFactory;
import com.phillippitts.callagent.service.orchestration.CallStart;
import com.phillippitts.callagent.service.streaming.MediaStreamConnection;
import com.phillippitts.callagent.service.streaming.MediaStreamFrames;
import com.phillippitts.callagent.service.streaming.MediaStreamFrames.InboundFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Telephony media stream endpoint.
 *
 * <p>One WebSocket connection carries one call. The orchestrator is created when the {@code start}
 * frame arrives; the call id is taken from the frame's {@code callSid}, then from the last path
 * segment of the connection URI ({@code /media/{callId}}), then from the WebSocket session id.
 * Caller and called numbers and the call direction come from the {@code From}, {@code To} and
 * {@code Direction} custom parameters.
 */
public class MediaStreamWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(MediaStreamWebSocketHandler.class);

    static final String PARAM_FROM = "From";
    static final String PARAM_TO = "To";
    static final String PARAM_DIRECTION = "Direction";

    private final CallOrchestratorFactory factory;
    private final BiFunction<WebSocketSession, String, MediaStreamConnection> connections;
    private final Map<String, CallOrchestrator> calls = new ConcurrentHashMap<>();

    public MediaStreamWebSocketHandler(CallOrchestratorFactory factory) {
        this(factory, WebSocketMediaStreamConnection::new);
    }

    MediaStreamWebSocketHandler(CallOrchestratorFactory factory,
                                BiFunction<WebSocketSession, String, MediaStreamConnection> connections) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        LOG.debug("Media stream connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        InboundFrame frame;
        try {
            frame = MediaStreamFrames.parse(message.getPayload());
        } catch (IllegalArgumentException e) {
            LOG.warn("Dropping malformed frame on {}: {}", session.getId(), e.getMessage());
            return;
        }

        CallOrchestrator call = calls.get(session.getId());
        if (call != null) {
            ThreadContext.put("callId", call.getCallId());
        }
        try {
            switch (frame.event()) {
                case START -> onStart(session, frame);
                case MEDIA -> {
                    if (call != null) {
                        call.onMedia(frame.payload());
                    }
                }
                case STOP -> {
                    if (call != null) {
                        LOG.info("Stop frame received for call {}", call.getCallId());
                        call.onStop();
                    }
                }
                case MARK -> LOG.debug("Mark {} on {}", frame.markName(), session.getId());
                case CONNECTED -> LOG.debug("Provider connected on {}", session.getId());
                default -> LOG.debug("Ignoring unknown event on {}", session.getId());
            }
        } finally {
            ThreadContext.remove("callId");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        CallOrchestrator call = calls.remove(session.getId());
        if (call != null) {
            LOG.info("Media stream closed for call {} ({})", call.getCallId(), status);
            call.onTransportClosed();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
    }

    public int activeCalls() {
        return calls.size();
    }

    private void onStart(WebSocketSession session, InboundFrame frame) {
        if (calls.containsKey(session.getId())) {
            LOG.warn("Duplicate start frame on {} ignored", session.getId());
            return;
        }
        String callId = resolveCallId(session, frame);
        ThreadContext.put("callId", callId);
        MediaStreamConnection connection = connections.apply(session, callId);
        CallOrchestrator call = factory.create(callId, connection, () -> calls.remove(session.getId()));
        calls.put(session.getId(), call);
        call.start(new CallStart(frame.streamSid(), frame.parameter(PARAM_TO), frame.parameter(PARAM_FROM),
                CallDirection.fromLabel(frame.parameter(PARAM_DIRECTION))));
    }

    static String resolveCallId(WebSocketSession session, InboundFrame frame) {
        if (!frame.callSid().isBlank()) {
            return frame.callSid();
        }
        URI uri = session.getUri();
        if (uri != null && uri.getPath() != null) {
            String path = uri.getPath();
            String last = path.substring(path.lastIndexOf('/') + 1);
            if (!last.isBlank() && !"media".equals(last)) {
                return last;
            }
        }
        return session.getId();
    }
}
