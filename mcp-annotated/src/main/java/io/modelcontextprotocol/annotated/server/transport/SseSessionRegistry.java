/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server.transport;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Open SSE sessions keyed by session id, with an optional cap on their number.
 * <p>
 * A slot is reserved before a connection is set up and either filled with
 * {@link #register(SseSession)} or given back with {@link #cancelReservation()}.
 */
final class SseSessionRegistry {

	private final Map<String, SseSession> sessions = new ConcurrentHashMap<>();

	private final AtomicInteger slots = new AtomicInteger();

	private final int maxSessions;

	/**
	 * @param maxSessions maximum number of sessions, {@code 0} or less for no limit
	 */
	SseSessionRegistry(int maxSessions) {
		this.maxSessions = maxSessions;
	}

	boolean tryReserve() {
		while (true) {
			int used = this.slots.get();
			if (this.maxSessions > 0 && used >= this.maxSessions) {
				return false;
			}
			if (this.slots.compareAndSet(used, used + 1)) {
				return true;
			}
		}
	}

	void cancelReservation() {
		this.slots.decrementAndGet();
	}

	void register(SseSession session) {
		this.sessions.put(session.id(), session);
	}

	SseSession get(String sessionId) {
		return this.sessions.get(sessionId);
	}

	/**
	 * @return the removed session, or {@code null} if it was not registered
	 */
	SseSession remove(String sessionId) {
		SseSession removed = this.sessions.remove(sessionId);
		if (removed != null) {
			this.slots.decrementAndGet();
		}
		return removed;
	}

	Collection<SseSession> all() {
		return List.copyOf(this.sessions.values());
	}

	int size() {
		return this.sessions.size();
	}

}
