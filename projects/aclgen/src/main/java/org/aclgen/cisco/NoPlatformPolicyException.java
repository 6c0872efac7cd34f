package org.aclgen.cisco;

import org.aclgen.common.AclgenException;

/** Thrown when a policy handed to a renderer has no filter targeting the renderer's platform. */
public class NoPlatformPolicyException extends AclgenException {

  private static final long serialVersionUID = 1L;

  public NoPlatformPolicyException(String msg) {
    super(msg);
  }
}
