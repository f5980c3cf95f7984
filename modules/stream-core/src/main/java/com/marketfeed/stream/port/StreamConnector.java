package com.marketfeed.stream.port;

import com.marketfeed.stream.connection.StreamConnection;

/** Establishes upstream feed connections for a provider and capability. */
public interface StreamConnector {
  StreamConnection connect(ConnectionRequest request);
}
