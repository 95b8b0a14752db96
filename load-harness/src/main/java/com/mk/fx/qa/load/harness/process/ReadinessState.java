package com.mk.fx.qa.load.harness.process;

/** Lifecycle of the startup wait. */
public enum ReadinessState {
  IDLE,
  STARTING,
  READY,
  FAILED
}
