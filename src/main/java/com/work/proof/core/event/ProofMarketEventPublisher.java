package com.work.proof.core.event;

/**
 * 事件发布端口（不强依赖 Spring 事件机制）。
 *
 * 核心路径只在操作整体成功后调用；宿主可接入 ApplicationEventPublisher、消息队列等实现。
 */
public interface ProofMarketEventPublisher {

    ProofMarketEventPublisher NOOP = event -> {
    };

    void publish(ProofMarketEvent event);
}
