package com.scholary.docjobs.module;

import java.util.List;

public record RoundResult(int round, List<ItemResult> items) {

  public RoundResult {
    items = List.copyOf(items);
  }

  public List<ItemResult> succeeded() {
    return items.stream().filter(ItemResult::succeeded).toList();
  }
}
