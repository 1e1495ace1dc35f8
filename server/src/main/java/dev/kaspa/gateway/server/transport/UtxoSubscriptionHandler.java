package dev.kaspa.gateway.server.transport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.KaspaNodeClient;
import dev.kaspa.gateway.rpc.model.UtxoChangeNotification;
import dev.kaspa.gateway.rpc.relay.NotificationSource;
import dev.kaspa.gateway.server.codec.KaspaMessageCodec;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

/**
 * WebSocket handler relaying UTXO change notifications. Every connection owns exactly one node
 * subscription: it is opened when the socket is established and released when the socket closes,
 * fails, or the node ends the stream.
 */
public class UtxoSubscriptionHandler extends TextWebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(UtxoSubscriptionHandler.class);

	private final KaspaNodeClient nodeClient;

	private final ObjectMapper objectMapper;

	private final ConcurrentHashMap<String, ActiveSubscription> subscriptionsBySessionId = new ConcurrentHashMap<>();

	/**
	 * Create a handler.
	 * @param nodeClient client used to open subscriptions
	 * @param objectMapper mapper used to render frames
	 */
	public UtxoSubscriptionHandler(KaspaNodeClient nodeClient, ObjectMapper objectMapper) {
		this.nodeClient = Objects.requireNonNull(nodeClient, "nodeClient");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
	}

	/**
	 * Number of sockets with a live subscription.
	 * @return active subscription count
	 */
	public int activeSubscriptions() {
		return this.subscriptionsBySessionId.size();
	}

	@Override
	@SuppressWarnings("unchecked")
	public void afterConnectionEstablished(WebSocketSession session) throws IOException {
		List<String> addresses = (List<String>) session.getAttributes()
			.get(AddressQueryHandshakeInterceptor.ADDRESSES_ATTRIBUTE);
		if (addresses == null || addresses.isEmpty()) {
			logger.warn("WebSocket {} opened without addresses", session.getId());
			closeQuietly(session, CloseStatus.POLICY_VIOLATION);
			return;
		}
		logger.info("New UTXO subscription on WebSocket {} for {} addresses", session.getId(), addresses.size());

		SessionSender sender = new SessionSender(session);
		NotificationSource source;
		try {
			source = this.nodeClient.subscribeUtxosChanged(addresses);
		}
		catch (GatewayException ex) {
			logger.error("Subscription for WebSocket {} failed: {}", session.getId(), ex.getMessage(), ex.getCause());
			sender.sendQuietly(KaspaMessageCodec.toErrorFrame("Failed to subscribe: " + ex.getMessage()));
			closeQuietly(session, CloseStatus.SERVER_ERROR);
			return;
		}

		ActiveSubscription active = new ActiveSubscription(source, sender);
		this.subscriptionsBySessionId.put(session.getId(), active);
		sender.send(KaspaMessageCodec.toSubscribedFrame(source.addresses()));

		active.disposable = source.notifications()
			.publishOn(Schedulers.boundedElastic(), 1)
			.subscribe(notification -> relay(sender, notification),
					error -> onStreamError(session, active, error),
					() -> onStreamEnd(session, active));
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		logger.debug("Ignoring inbound frame on WebSocket {}: {}", session.getId(), message.getPayload());
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		logger.warn("Transport error detected on WebSocket {}", session.getId(), exception);
		release(session.getId());
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		logger.info("WebSocket connection {} closed with status {}", session.getId(), status);
		release(session.getId());
	}

	private void relay(SessionSender sender, UtxoChangeNotification notification) {
		try {
			sender.send(KaspaMessageCodec.toNotificationFrame(notification));
		}
		catch (IOException ex) {
			throw new UncheckedIOException(ex);
		}
	}

	private void onStreamError(WebSocketSession session, ActiveSubscription active, Throwable error) {
		this.subscriptionsBySessionId.remove(session.getId(), active);
		active.source.close();
		if (error instanceof UncheckedIOException) {
			logger.warn("Client on WebSocket {} disconnected", session.getId());
		}
		else {
			logger.error("Subscription stream for WebSocket {} failed", session.getId(), error);
			active.sender.sendQuietly(KaspaMessageCodec.toErrorFrame("Stream error: " + error.getMessage()));
		}
		closeQuietly(session, CloseStatus.SERVER_ERROR);
	}

	private void onStreamEnd(WebSocketSession session, ActiveSubscription active) {
		this.subscriptionsBySessionId.remove(session.getId(), active);
		logger.info("UTXO subscription for WebSocket {} ended by the node", session.getId());
		closeQuietly(session, CloseStatus.NORMAL);
	}

	private void release(String sessionId) {
		ActiveSubscription active = this.subscriptionsBySessionId.remove(sessionId);
		if (active != null) {
			active.dispose();
			logger.info("UTXO subscription for WebSocket {} released", sessionId);
		}
	}

	private static void closeQuietly(WebSocketSession session, CloseStatus status) {
		try {
			if (session.isOpen()) {
				session.close(status);
			}
		}
		catch (IOException ex) {
			logger.warn("Failed to close WebSocket session {}", session.getId(), ex);
		}
	}

	/**
	 * Node subscription bound to one socket.
	 */
	private static final class ActiveSubscription {

		private final NotificationSource source;

		private final SessionSender sender;

		private volatile Disposable disposable;

		private ActiveSubscription(NotificationSource source, SessionSender sender) {
			this.source = source;
			this.sender = sender;
		}

		private void dispose() {
			Disposable current = this.disposable;
			if (current != null) {
				current.dispose();
			}
			this.source.close();
		}

	}

	/**
	 * Serialises frames and writes them to the socket one at a time.
	 */
	private final class SessionSender {

		private final WebSocketSession session;

		private final ReentrantLock sendLock = new ReentrantLock();

		private SessionSender(WebSocketSession session) {
			this.session = session;
		}

		private void send(Object frame) throws IOException {
			String payload;
			try {
				payload = objectMapper.writeValueAsString(frame);
			}
			catch (JsonProcessingException ex) {
				throw new IllegalStateException("Failed to serialise WebSocket frame", ex);
			}
			this.sendLock.lock();
			try {
				if (!this.session.isOpen()) {
					throw new IOException("WebSocket session " + this.session.getId() + " is closed");
				}
				this.session.sendMessage(new TextMessage(payload));
			}
			finally {
				this.sendLock.unlock();
			}
			logger.debug("Sent frame on WebSocket {}: {}", this.session.getId(), payload);
		}

		private void sendQuietly(Object frame) {
			try {
				send(frame);
			}
			catch (IOException ex) {
				logger.warn("Failed to send frame on WebSocket {}", this.session.getId(), ex);
			}
		}

	}

}
