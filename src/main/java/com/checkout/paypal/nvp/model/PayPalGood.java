package com.checkout.paypal.nvp.model;

/**
 * A physical line item. The optional {@code id} is sent as the item number.
 */
public class PayPalGood {

  private String id;
  private String name;
  private double amount;
  private int quantity;

  public PayPalGood() {
  }

  public PayPalGood(String id, String name, double amount, int quantity) {
    this.id = id;
    this.name = name;
    this.amount = amount;
    this.quantity = quantity;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
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
