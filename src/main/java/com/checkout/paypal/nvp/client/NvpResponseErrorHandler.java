package com.checkout.paypal.nvp.client;

import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.DefaultResponseErrorHandler;

/**
 * Treats every HTTP status as a readable NVP reply. PayPal reports failures in the body
 * ({@code ACK}, {@code L_ERRORCODE0}), so a 4xx or 5xx reply is decoded like any other
 * and turned into a {@link com.checkout.paypal.nvp.exception.PayPalException} when it
 * carries an error.
 */
public class NvpResponseErrorHandler extends DefaultResponseErrorHandler {

  @Override
  public boolean hasError(ClientHttpResponse response) {
    return false;
  }
}
