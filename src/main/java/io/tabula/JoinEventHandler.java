/*
 * SPDX-FileCopyrightText: Copyright (c) 2025, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tabula;

/**
 * Callbacks for operationally significant events inside an inequality join. Handlers run on
 * the thread doing the join.
 */
public interface JoinEventHandler {
  /** A handler that ignores everything. */
  JoinEventHandler NONE = new JoinEventHandler() {};

  /**
   * Invoked once a join has picked its strategy, before any pairs are produced.
   * @param strategy the algorithm that will run
   * @param leftRows rows in the left table
   * @param rightRows rows in the right table
   */
  default void onStrategySelected(JoinStrategy strategy, long leftRows, long rightRows) {
  }

  /**
   * Invoked when the predicates could not be classified and the join degrades to testing every
   * pair of rows.
   * @param reason why the accelerated paths were not usable
   * @param leftRows rows in the left table
   * @param rightRows rows in the right table
   */
  default void onNestedLoopFallback(String reason, long leftRows, long rightRows) {
  }
}
