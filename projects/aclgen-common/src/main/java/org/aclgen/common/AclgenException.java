package org.aclgen.common;

/** Thrown when a policy cannot be turned into a correct filter configuration. */
public class AclgenException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public AclgenException(String msg) {
    super(msg);
  }

  public AclgenException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
