package com.checkout.paypal.nvp.exception;

/**
 * Thrown when a PayPal reply body cannot be decoded as a URL-encoded NVP string.
 */
public class InvalidNvpResponseException extends RuntimeException {

  public InvalidNvpResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
