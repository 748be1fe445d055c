package com.pokeme.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/** Fallback notifier that writes the notification to the broker log. */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);
    private static final int MAX_BODY = 120;
    // word chars, whitespace and a little punctuation; no quotes, shell or markup characters
    private static final Pattern UNSAFE = Pattern.compile("[^\\w\\s\\-.,?:() ]", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public void notify(String question, String agent, String url) {
        var title = agent != null && !agent.isBlank() ? "pokeme: " + sanitize(agent) : "pokeme";
        log.info("{}: {} (respond at {})", title, body(question), url);
    }

    static String body(String question) {
        var body = sanitize(question);
        if (body.codePointCount(0, body.length()) > MAX_BODY) {
            body = body.substring(0, body.offsetByCodePoints(0, MAX_BODY - 3)) + "...";
        }
        return body;
    }

    static String sanitize(String text) {
        if (text == null) return "";
        return UNSAFE.matcher(text).replaceAll("");
    }
}
