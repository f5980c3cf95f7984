package com.marketfeed.stream.port;

/** Field-mapping engine that turns provider payloads into canonical records. */
public interface DataTransformer {
  TransformResult transform(TransformRequest request);
}
