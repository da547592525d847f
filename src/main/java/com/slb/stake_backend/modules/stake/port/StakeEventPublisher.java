package com.slb.stake_backend.modules.stake.port;

import com.slb.stake_backend.modules.event.entity.StakeEvent;

/**
 * 事件发布，发出即不管。实现不能把异常抛回已提交的账本操作，调用方在释放账本锁之后才调用。
 */
public interface StakeEventPublisher {

    void publish(StakeEvent event);
}
