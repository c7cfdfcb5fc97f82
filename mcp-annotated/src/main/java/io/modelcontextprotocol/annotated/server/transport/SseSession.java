/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server.transport;

import java.util.concurrent.locks.ReentrantReadWriteLock;

import io.modelcontextprotocol.spec.McpServerSession;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Registry entry of one open SSE connection.
 * <p>
 * Message routing holds the read lock for as long as it uses the session; closing takes
 * the write lock to mark the entry closed, so teardown starts only after every in-flight
 * message is done and no new message is routed afterwards.
 */
final class SseSession {

	private final String id;

	private final HttpServletSseMultiplexer.SessionTransport transport;

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private volatile McpServerSession serverSession;

	private volatile Disposable keepAlive;

	private boolean closed;

	SseSession(String id, HttpServletSseMultiplexer.SessionTransport transport) {
		this.id = id;
		this.transport = transport;
	}

	String id() {
		return this.id;
	}

	HttpServletSseMultiplexer.SessionTransport transport() {
		return this.transport;
	}

	McpServerSession serverSession() {
		return this.serverSession;
	}

	void attach(McpServerSession serverSession) {
		this.serverSession = serverSession;
	}

	void keepAlive(Disposable keepAlive) {
		this.keepAlive = keepAlive;
	}

	/**
	 * Acquires the session for routing one message. Must be paired with
	 * {@link #release()} when it returns {@code true}.
	 * @return {@code false} if the session is closed
	 */
	boolean tryAcquire() {
		this.lock.readLock().lock();
		if (this.closed) {
			this.lock.readLock().unlock();
			return false;
		}
		return true;
	}

	void release() {
		this.lock.readLock().unlock();
	}

	boolean isClosed() {
		this.lock.readLock().lock();
		try {
			return this.closed;
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * Marks the session closed, then closes the server session and ends the stream.
	 * Blocks until in-flight messages are done; subscribe off the request threads.
	 */
	Mono<Void> close() {
		return Mono.defer(() -> {
			this.lock.writeLock().lock();
			try {
				if (this.closed) {
					return Mono.empty();
				}
				this.closed = true;
			}
			finally {
				this.lock.writeLock().unlock();
			}
			Disposable keepAlive = this.keepAlive;
			if (keepAlive != null) {
				keepAlive.dispose();
			}
			McpServerSession session = this.serverSession;
			Mono<Void> sessionClose = session != null ? session.closeGracefully() : Mono.empty();
			return sessionClose.doFinally(signal -> this.transport.complete());
		});
	}

}
