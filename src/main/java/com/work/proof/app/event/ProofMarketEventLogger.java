package com.work.proof.app.event;

import com.work.proof.core.event.ProofMarketEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class ProofMarketEventLogger {

    private static final Logger log = LoggerFactory.getLogger(ProofMarketEventLogger.class);

    @EventListener
    public void onEvent(ProofMarketEvent event) {
        log.info("event type={} network={} ts={} detail={}", event.getType(), event.getNetwork(),
                event.getTimestamp(), event);
    }
}
