package org.aclgen.cisco;

import org.aclgen.common.AclgenException;

/** Thrown in strict mode for protocol names that are neither numbers nor in the protocol table. */
public class UnknownProtocolException extends AclgenException {

  private static final long serialVersionUID = 1L;

  public UnknownProtocolException(String msg) {
    super(msg);
  }
}
