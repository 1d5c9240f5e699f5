package com.plagiarism.dispatcher.service;

import com.plagiarism.dispatcher.pool.ApiKeyPool;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class KeyRecoverySchedulerTest {

    private final ApiKeyPool pool = mock(ApiKeyPool.class);
    private final KeyRecoveryScheduler scheduler = new KeyRecoveryScheduler(pool);

    @Test
    void skipsWhenNothingFailed() {
        when(pool.failedCount()).thenReturn(0L);

        scheduler.recoverKeys();

        verify(pool, never()).recoverFailedKeys();
    }

    @Test
    void delegatesRecoveryToPool() {
        when(pool.failedCount()).thenReturn(2L, 1L);
        when(pool.recoverFailedKeys()).thenReturn(1);

        scheduler.recoverKeys();

        verify(pool).recoverFailedKeys();
    }
}
