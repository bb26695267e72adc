package io.b2mash.compliance.multitenancy;

public class MemberContextNotBoundException extends RuntimeException {

  public MemberContextNotBoundException() {
    super("Member context not available: no member bound to the current request");
  }
}
