package com.checkout.paypal.nvp.enums;

/**
 * How PayPal settles an Express Checkout payment.
 *
 * <ul>
 *   <li>{@link #SALE} - final sale, funds are captured immediately</li>
 *   <li>{@link #AUTHORIZATION} - funds are authorized for a later capture</li>
 *   <li>{@link #ORDER} - order placed now, authorized and captured later (ship later)</li>
 * </ul>
 */
public enum PaymentAction {
  SALE("Sale"),
  AUTHORIZATION("Authorization"),
  ORDER("Order");

  private final String value;

  PaymentAction(String value) {
    this.value = value;
  }

  /** The value sent in {@code PAYMENTREQUEST_0_PAYMENTACTION}. */
  public String getValue() {
    return value;
  }
}
