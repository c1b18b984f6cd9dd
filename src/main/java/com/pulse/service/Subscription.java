package com.pulse.service;

/**
 * 存储订阅句柄
 */
public interface Subscription {

    /**
     * 取消订阅，可重复调用
     */
    void unsubscribe();
}
