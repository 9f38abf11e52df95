package com.slack.querier.merge;

import com.slack.querier.model.Volume;
import com.slack.querier.model.VolumeResponse;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges volume responses into the top entries by volume. Entries with the same name coming from
 * different ingesters are summed before ranking. Entries with equal volume are ordered by name.
 * A limit of zero or less keeps every entry.
 */
public class VolumeMerger implements ResponseMerger<VolumeResponse> {
  private static final Comparator<Volume> BY_VOLUME_DESC =
      Comparator.comparingLong(Volume::volume).reversed().thenComparing(Volume::name);

  private final int limit;

  public VolumeMerger(int limit) {
    this.limit = limit;
  }

  @Override
  public VolumeResponse merge(List<VolumeResponse> responses) {
    Map<String, Long> volumesByName = new HashMap<>();
    for (VolumeResponse response : responses) {
      if (response == null || response.volumes() == null) {
        continue;
      }
      for (Volume volume : response.volumes()) {
        volumesByName.merge(volume.name(), volume.volume(), Long::sum);
      }
    }

    List<Volume> volumes = new ArrayList<>(volumesByName.size());
    volumesByName.forEach((name, volume) -> volumes.add(new Volume(name, volume)));
    volumes.sort(BY_VOLUME_DESC);

    if (limit > 0 && volumes.size() > limit) {
      return new VolumeResponse(List.copyOf(volumes.subList(0, limit)), limit);
    }
    return new VolumeResponse(List.copyOf(volumes), limit);
  }
}
