package jstate.parser;

/**
 * Shape of the edges inside one state machine block.
 */
public enum Dialect {
  // `From -> To`: every state has at most one successor
  UNNAMED,
  // `From -(transition)-> To`: states expose named transitions
  NAMED;
}
