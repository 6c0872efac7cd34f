package org.aclgen.cisco;

import org.aclgen.common.AclgenException;

/**
 * Thrown when a filter asks for an access-list type the platform does not have, or uses a name that
 * its access-list type does not allow.
 */
public class UnsupportedAccessListException extends AclgenException {

  private static final long serialVersionUID = 1L;

  public UnsupportedAccessListException(String msg) {
    super(msg);
  }
}
