/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

import com.opengamma.strata.collect.Messages;
import com.opengamma.strata.collect.result.FailureItem;
import com.opengamma.strata.collect.result.FailureReason;

/**
 * Base exception for the conditions raised while building curves, spreads and hedges.
 * <p>
 * Each subclass describes a failure scoped to one tenor point, one issuer or one mode.
 * Callers working on collections convert them to {@link FailureItem} with {@link #toFailureItem()}.
 */
public abstract class RelativeValueException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an instance.
   * 
   * @param message  the message, with '{}' placeholders
   * @param args  the message arguments
   */
  protected RelativeValueException(String message, Object... args) {
    super(Messages.format(message, args));
  }

  /**
   * Creates an instance with a cause.
   * 
   * @param cause  the underlying cause
   * @param message  the message, with '{}' placeholders
   * @param args  the message arguments
   */
  protected RelativeValueException(Throwable cause, String message, Object... args) {
    super(Messages.format(message, args), cause);
  }

  /**
   * The reason used when the exception is reported as a failure item.
   * 
   * @return the reason
   */
  public abstract FailureReason getFailureReason();

  /**
   * Converts the exception to a failure item, keeping the message as context.
   * 
   * @return the failure item
   */
  public FailureItem toFailureItem() {
    return FailureItem.of(getFailureReason(), getMessage());
  }

}
