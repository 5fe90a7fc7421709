package com.machine.signals.service;

import com.machine.common.dto.SignalRecord;
import com.machine.common.model.SignalType;
import com.machine.signals.exception.ConstraintViolationException;
import com.machine.signals.model.SignalRecordEntity;
import com.machine.signals.repository.SignalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSignalSink implements SignalSink {

    private static final Sort NEWEST_FIRST = Sort.by(
            Sort.Order.desc("timestamp"),
            Sort.Order.desc("id"));

    private final SignalRepository signalRepository;
    private final StorageExceptionTranslator exceptionTranslator;

    @Override
    public long insert(SignalRecord record) {
        if (record.signalType() == null) {
            throw new ConstraintViolationException("signal_type is required");
        }

        try {
            SignalRecordEntity saved = signalRepository.save(SignalRecordEntity.fromRecord(record));
            log.trace("Stored {} reading with id={}", record.signalType(), saved.getId());
            return saved.getId();
        } catch (RuntimeException e) {
            throw exceptionTranslator.translateWrite(e);
        }
    }

    @Override
    public List<SignalRecord> queryRecent(SignalType signalType, int limit) {
        try {
            return signalRepository.findBySignalType(signalType, PageRequest.of(0, limit, NEWEST_FIRST))
                    .stream()
                    .map(SignalRecordEntity::toRecord)
                    .toList();
        } catch (RuntimeException e) {
            throw exceptionTranslator.translateRead(e);
        }
    }
}
