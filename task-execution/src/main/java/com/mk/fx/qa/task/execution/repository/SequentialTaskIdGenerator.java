package com.mk.fx.qa.task.execution.repository;

import java.util.concurrent.atomic.AtomicLong;

/** Hands out increasing numeric ids starting at 1. Ids are never reused. */
public class SequentialTaskIdGenerator {

  private final AtomicLong sequence = new AtomicLong();

  public String nextId() {
    return Long.toString(sequence.incrementAndGet());
  }
}
