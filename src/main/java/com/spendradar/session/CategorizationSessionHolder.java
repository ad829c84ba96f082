package com.spendradar.session;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Application-wide current session, opened on first use and replaced on refresh.
 */
@Component
@RequiredArgsConstructor
public class CategorizationSessionHolder {

    private final CategorizationSessionService sessionService;
    private final AtomicReference<CategorizationSession> current = new AtomicReference<>();

    public CategorizationSession current() {
        CategorizationSession session = current.get();
        if (session != null) {
            return session;
        }
        synchronized (current) {
            if (current.get() == null) {
                current.set(sessionService.openSession());
            }
            return current.get();
        }
    }

    public CategorizationSession refresh() {
        CategorizationSession session = sessionService.openSession();
        current.set(session);
        return session;
    }
}
