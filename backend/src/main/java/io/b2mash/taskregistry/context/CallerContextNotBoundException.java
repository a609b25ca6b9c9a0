package io.b2mash.taskregistry.context;

public class CallerContextNotBoundException extends RuntimeException {

  public CallerContextNotBoundException() {
    super("Caller context not available: CALLER not bound by filter chain");
  }
}
