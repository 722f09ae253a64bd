package com.analytics.workflow.domain.service;

/**
 * Blocking pause, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper THREAD = Thread::sleep;
    
    void sleep(long millis) throws InterruptedException;
}
