package com.machine.signals.service;

import com.machine.common.dto.SignalResponse;
import com.machine.common.model.SignalType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side: the most recent window of one signal type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalQueryService {

    /**
     * Size of the recent window served per signal type.
     */
    public static final int RECENT_LIMIT = 10;

    private final SignalSink signalSink;

    /**
     * Validates the requested type before touching storage.
     *
     * @throws com.machine.common.exception.InvalidSignalTypeException for types outside the closed set
     */
    public List<SignalResponse> getRecentSignals(String signalType) {
        SignalType type = SignalType.fromValue(signalType);
        log.debug("Fetching {} most recent {} signals", RECENT_LIMIT, type);

        return signalSink.queryRecent(type, RECENT_LIMIT).stream()
                .map(SignalResponse::from)
                .toList();
    }
}
