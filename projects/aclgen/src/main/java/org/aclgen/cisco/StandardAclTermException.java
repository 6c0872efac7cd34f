package org.aclgen.cisco;

import org.aclgen.common.AclgenException;

/** Thrown when a term uses a match field or option that standard access lists cannot express. */
public class StandardAclTermException extends AclgenException {

  private static final long serialVersionUID = 1L;

  public StandardAclTermException(String msg) {
    super(msg);
  }
}
