package com.forecastplatform.engine.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory home of every generation session.
 *
 * <p>Running sessions are never evicted. Once more than {@code maxRetained} finished
 * sessions are held, the oldest finished ones are discarded together with their trees.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, GenerationSession> sessions     = new ConcurrentHashMap<>();
    private final Map<String, Long>              registeredAt = new ConcurrentHashMap<>();
    private final AtomicLong                     sequence     = new AtomicLong();
    private final int maxRetained;

    public SessionRegistry(@Value("${forecast.sessions.max-retained:20}") int maxRetained) {
        this.maxRetained = Math.max(1, maxRetained);
    }

    public GenerationSession register(GenerationSession session) {
        registeredAt.put(session.id(), sequence.getAndIncrement());
        sessions.put(session.id(), session);
        evictFinished();
        return session;
    }

    /**
     * @throws SessionNotFoundException if no session has that id
     */
    public GenerationSession get(String sessionId) {
        GenerationSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public GenerationSession remove(String sessionId) {
        GenerationSession removed = sessionId != null ? sessions.remove(sessionId) : null;
        if (removed == null) {
            throw new SessionNotFoundException(sessionId);
        }
        registeredAt.remove(sessionId);
        return removed;
    }

    public Collection<GenerationSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    synchronized void evictFinished() {
        List<GenerationSession> finished = new ArrayList<>();
        for (GenerationSession s : sessions.values()) {
            if (s.status().isFinished()) finished.add(s);
        }
        if (finished.size() <= maxRetained) {
            return;
        }
        finished.sort(Comparator.comparingLong(s -> registeredAt.getOrDefault(s.id(), Long.MAX_VALUE)));
        int excess = finished.size() - maxRetained;
        for (int i = 0; i < excess; i++) {
            GenerationSession evicted = finished.get(i);
            sessions.remove(evicted.id());
            registeredAt.remove(evicted.id());
            log.info("[Sessions] Evicted finished session. sessionId={} status={}",
                     evicted.id(), evicted.status());
        }
    }
}
