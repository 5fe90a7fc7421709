package com.machine.signals.repository;

import com.machine.common.model.SignalType;
import com.machine.signals.model.SignalRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SignalRepository extends JpaRepository<SignalRecordEntity, Long> {

    List<SignalRecordEntity> findBySignalType(SignalType signalType, Pageable pageable);
}
