package com.checkout.paypal.nvp.model;

import java.util.List;

/**
 * A digital line item, sent with item category {@code Digital}.
 */
public class PayPalDigitalGood {

  private String name;
  private double amount;
  private int quantity;

  public PayPalDigitalGood() {
  }

  public PayPalDigitalGood(String name, double amount, int quantity) {
    this.name = name;
    this.amount = amount;
    this.quantity = quantity;
  }

  /**
   * Sums {@code amount * quantity} over the given goods.
   *
   * @param goods the digital goods of an order
   * @return the total of all goods; {@code 0} for an empty list
   */
  public static double sumAmounts(List<PayPalDigitalGood> goods) {
    double sum = 0;
    for (PayPalDigitalGood good : goods) {
      sum += good.getAmount() * good.getQuantity();
    }
    return sum;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public double getAmount() {
    return amount;
  }

  public void setAmount(double amount) {
    this.amount = amount;
  }

  public int getQuantity() {
    return quantity;
  }

  public void setQuantity(int quantity) {
    this.quantity = quantity;
  }
}
