package schedc.frontend;

/**
 * A component description could not be read.
 */
public class FrontendException extends Exception {
  private static final long serialVersionUID = 1L;

  public FrontendException(String message) { super(message); }

  public FrontendException(String message, Throwable cause) { super(message, cause); }
}
