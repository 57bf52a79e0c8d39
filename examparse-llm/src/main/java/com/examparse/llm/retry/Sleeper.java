package com.examparse.llm.retry;

@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleeper() {
        return Thread::sleep;
    }
}
