package jabuti.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a canonicalizer bug or a mismatch between the
 * canonicalizer and the grammar front end, never a problem in the
 * contract document itself.
 * */
public class CanonicalizerRuntimeError extends RuntimeException
{
  public CanonicalizerRuntimeError(String msg)
  {
    super(msg);
  }

  public CanonicalizerRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
