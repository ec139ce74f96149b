package com.dayloop.timeline.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Single writer for the store. Every mutation (ingestion, batch save, eviction, card
 * replacement, reprocess cleanup) runs here, one at a time, each in its own transaction.
 * Reads go straight to the repositories and may interleave.
 */
@Component
public class StoreWriter {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public StoreWriter(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T write(TransactionCallback<T> work) {
        lock.lock();
        try {
            return transactionTemplate.execute(work);
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable work) {
        write(status -> {
            work.run();
            return null;
        });
    }
}
