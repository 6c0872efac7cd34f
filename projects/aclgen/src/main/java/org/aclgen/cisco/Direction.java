package org.aclgen.cisco;

/** Which end of a flow a match field applies to. */
public enum Direction {
  SOURCE,
  DESTINATION
}
