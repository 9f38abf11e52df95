package com.slack.querier.model;

import java.util.List;

public record VolumeResponse(List<Volume> volumes, int limit) {
  public static VolumeResponse empty() {
    return new VolumeResponse(List.of(), 0);
  }
}
