package com.machine.signals.service;

import com.machine.common.dto.SignalRecord;
import com.machine.common.model.SignalType;

import java.util.List;

/**
 * Append-only store of signal records.
 *
 * Implementations borrow one pooled connection per call and return it before
 * the call completes, whatever the outcome.
 */
public interface SignalSink {

    /**
     * Persists one reading and returns the id assigned by the store.
     *
     * @throws com.machine.signals.exception.StorageUnavailableException if no connection can be established
     * @throws com.machine.signals.exception.ConstraintViolationException if the row is rejected
     * @throws com.machine.signals.exception.BackpressureException if the pool stayed exhausted
     * @throws com.machine.signals.exception.TransientStorageException if the write may succeed when retried
     */
    long insert(SignalRecord record);

    /**
     * Returns up to {@code limit} readings of one type, newest first. Ties on
     * timestamp are broken by the higher id first. Never null, possibly empty.
     */
    List<SignalRecord> queryRecent(SignalType signalType, int limit);
}
