package com.marketfeed.stream.pipeline;

import com.marketfeed.stream.error.StreamException;

/** A data pipeline stage failed or exceeded its timeout. */
public class PipelineStageException extends StreamException {
  public static final String CODE = "PIPELINE_STAGE_FAILED";

  private final PipelineStage stage;
  private final PipelineErrorCategory category;

  public PipelineStageException(PipelineStage stage, String message, Throwable cause) {
    this(stage, PipelineErrorCategory.classifyMessage(message), message, cause);
  }

  public PipelineStageException(
      PipelineStage stage, PipelineErrorCategory category, String message, Throwable cause) {
    super(CODE, message, cause);
    this.stage = stage;
    this.category = category;
  }

  public PipelineStage stage() {
    return stage;
  }

  public PipelineErrorCategory category() {
    return category;
  }
}
