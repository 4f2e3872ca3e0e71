package com.scholary.docjobs.module;

import com.scholary.docjobs.job.SuccessThreshold;
import java.util.List;

/** The items of one round and the share of them that must succeed. */
public record RoundPlan(List<PlannedItem> items, SuccessThreshold threshold) {

  public RoundPlan {
    if (items == null || items.isEmpty()) {
      throw new IllegalArgumentException("A round needs at least one item");
    }
    items = List.copyOf(items);
  }
}
