package com.fxtrader.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the broker gateway when its venue session opens or closes.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>DrawdownGuard: re-reads its reference balance from the new session's account</li>
 * </ul>
 */
public class SessionEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final String accountId;

    public SessionEvent(Object source, SessionEventType eventType, String accountId) {
        super(source);
        this.eventType = eventType;
        this.accountId = accountId;
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public String getAccountId() {
        return accountId;
    }
}
