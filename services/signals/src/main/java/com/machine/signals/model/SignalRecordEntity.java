package com.machine.signals.model;

import com.machine.common.dto.SignalRecord;
import com.machine.common.model.SignalType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Append-only row of the signal table. Rows are inserted once and never updated.
 */
@Entity
@Immutable
@Table(name = SignalRecordEntity.TABLE, indexes = {
    @Index(name = "idx_signal_type_timestamp", columnList = "signal_type, timestamp")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SignalRecordEntity {

    public static final String TABLE = "machine_signals";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = SignalTypeConverter.class)
    @Column(name = "signal_type", nullable = false, updatable = false, length = 50)
    private SignalType signalType;

    @Column(name = "value", nullable = false, updatable = false)
    private double value;

    // Plain TIMESTAMP holding UTC wall time, matching tables created by the producer
    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(name = "timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    public static SignalRecordEntity fromRecord(SignalRecord record) {
        return SignalRecordEntity.builder()
                .signalType(record.signalType())
                .value(record.value())
                .timestamp(record.timestamp())
                .build();
    }

    public SignalRecord toRecord() {
        return new SignalRecord(id, signalType, value, timestamp);
    }
}
