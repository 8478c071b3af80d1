package com.checkout.paypal.nvp.model;

/**
 * Order totals and redirect URLs for a {@code SetExpressCheckout} call.
 *
 * <p>Amounts are in the order's currency. A positive {@code discount} is sent to PayPal as an
 * extra negative line item named {@code DISCOUNT}.
 */
public class PayPalOrder {

  private double subTotal;
  private double shipping;
  private double discount;
  private double total;
  private String currencyCode;
  private String returnUrl;
  private String cancelUrl;

  public double getSubTotal() {
    return subTotal;
  }

  public void setSubTotal(double subTotal) {
    this.subTotal = subTotal;
  }

  public double getShipping() {
    return shipping;
  }

  public void setShipping(double shipping) {
    this.shipping = shipping;
  }

  public double getDiscount() {
    return discount;
  }

  public void setDiscount(double discount) {
    this.discount = discount;
  }

  public double getTotal() {
    return total;
  }

  public void setTotal(double total) {
    this.total = total;
  }

  public String getCurrencyCode() {
    return currencyCode;
  }

  public void setCurrencyCode(String currencyCode) {
    this.currencyCode = currencyCode;
  }

  public String getReturnUrl() {
    return returnUrl;
  }

  public void setReturnUrl(String returnUrl) {
    this.returnUrl = returnUrl;
  }

  public String getCancelUrl() {
    return cancelUrl;
  }

  public void setCancelUrl(String cancelUrl) {
    this.cancelUrl = cancelUrl;
  }
}
