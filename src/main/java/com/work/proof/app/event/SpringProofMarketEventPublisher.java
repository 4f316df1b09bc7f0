package com.work.proof.app.event;

import com.work.proof.core.event.ProofMarketEvent;
import com.work.proof.core.event.ProofMarketEventPublisher;
import org.springframework.context.ApplicationEventPublisher;

/**
 * 把 core 事件写入事件日志，并转发为 Spring 应用事件。
 */
public class SpringProofMarketEventPublisher implements ProofMarketEventPublisher {

    private final EventJournal journal;
    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringProofMarketEventPublisher(EventJournal journal, ApplicationEventPublisher applicationEventPublisher) {
        this.journal = journal;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(ProofMarketEvent event) {
        journal.append(event);
        applicationEventPublisher.publishEvent(event);
    }
}
