package com.marketfeed.stream.testing;

import com.marketfeed.stream.port.DataTransformer;
import com.marketfeed.stream.port.TransformRequest;
import com.marketfeed.stream.port.TransformResult;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

public class StubDataTransformer implements DataTransformer {
  private final List<TransformRequest> requests = new CopyOnWriteArrayList<>();
  private volatile Function<TransformRequest, TransformResult> behaviour;

  public StubDataTransformer(Function<TransformRequest, TransformResult> behaviour) {
    this.behaviour = behaviour;
  }

  public static StubDataTransformer passThrough() {
    return new StubDataTransformer(request -> new TransformResult(request.rawData()));
  }

  public void behave(Function<TransformRequest, TransformResult> behaviour) {
    this.behaviour = behaviour;
  }

  public List<TransformRequest> requests() {
    return List.copyOf(requests);
  }

  public int calls() {
    return requests.size();
  }

  @Override
  public TransformResult transform(TransformRequest request) {
    requests.add(request);
    return behaviour.apply(request);
  }
}
