package com.github.fsmhub;

/**
 * How queued events of a machine instance get processed.
 */
public enum DispatchMode {
  // a daemon polling loop drains the queue as events arrive
  AUTO_ASYNC,
  // callers drive processing via processNext() or drain()
  MANUAL;
}
