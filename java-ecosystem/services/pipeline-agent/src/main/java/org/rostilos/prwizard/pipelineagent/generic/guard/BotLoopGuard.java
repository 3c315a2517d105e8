package org.rostilos.prwizard.pipelineagent.generic.guard;

import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drops events authored by automated accounts, including this App's own replies.
 */
@Component
public class BotLoopGuard {

    private static final Logger log = LoggerFactory.getLogger(BotLoopGuard.class);

    private static final String BOT_TYPE = "Bot";
    private static final String BOT_LOGIN_SUFFIX = "[bot]";

    public boolean isAutomated(CommentEvent event) {
        return isAutomated(event.senderType(), event.senderLogin());
    }

    public boolean isAutomated(String senderType, String senderLogin) {
        if (BOT_TYPE.equalsIgnoreCase(senderType)) {
            return true;
        }
        return senderLogin != null && senderLogin.endsWith(BOT_LOGIN_SUFFIX);
    }

    /**
     * @return true when the event may be processed
     */
    public boolean admit(CommentEvent event) {
        if (isAutomated(event)) {
            log.info("Skipping {} {} from automated sender {}", event.source(), event.commentId(), event.senderLogin());
            return false;
        }
        return true;
    }
}
