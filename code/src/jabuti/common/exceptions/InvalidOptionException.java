package jabuti.common.exceptions;

/**
 * A compiler setting had a missing or unparseable value
 */
public class InvalidOptionException extends UserException {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
