package com.pokeme.notify;

/**
 * Tells the human that an agent is waiting. Implementations render a platform
 * notification; delivery is best effort.
 */
@FunctionalInterface
public interface Notifier {

    /**
     * @param question the question the agent is asking
     * @param agent    name of the agent, may be null
     * @param url      where the human can respond
     */
    void notify(String question, String agent, String url);
}
