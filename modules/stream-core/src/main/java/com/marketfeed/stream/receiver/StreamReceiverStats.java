package com.marketfeed.stream.receiver;

import com.marketfeed.stream.batch.BatchStats;
import com.marketfeed.stream.batch.CircuitBreakerState;
import com.marketfeed.stream.connection.ConnectionStats;
import com.marketfeed.stream.port.ClientStateStats;

public record StreamReceiverStats(
    BatchStats batch,
    CircuitBreakerState circuitBreaker,
    ConnectionStats connections,
    ClientStateStats clients) {}
