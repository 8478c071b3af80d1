package com.checkout.paypal.nvp.exception;

import com.checkout.paypal.nvp.model.PayPalError;
import com.checkout.paypal.nvp.model.PayPalResponse;

/**
 * Thrown when PayPal answers an NVP call with a failure ack or an error code.
 *
 * <p>Carries the structured {@link PayPalError} and the decoded {@link PayPalResponse},
 * so callers can still read the correlation id and any other reply fields.
 */
public class PayPalException extends RuntimeException {

  private final PayPalError error;
  private final PayPalResponse response;

  public PayPalException(PayPalError error, PayPalResponse response) {
    super(error.getMessage());
    this.error = error;
    this.response = response;
  }

  public PayPalError getError() {
    return error;
  }

  public PayPalResponse getResponse() {
    return response;
  }
}
