package com.checkout.paypal.nvp.enums;

/**
 * PayPal environment a client talks to. Each environment has its own NVP API endpoint
 * and its own buyer-facing checkout page.
 */
public enum PayPalEnvironment {
  SANDBOX("https://api-3t.sandbox.paypal.com/nvp",
      "https://www.sandbox.paypal.com/cgi-bin/webscr"),
  PRODUCTION("https://api-3t.paypal.com/nvp",
      "https://www.paypal.com/cgi-bin/webscr");

  private final String nvpUrl;
  private final String checkoutUrl;

  PayPalEnvironment(String nvpUrl, String checkoutUrl) {
    this.nvpUrl = nvpUrl;
    this.checkoutUrl = checkoutUrl;
  }

  public String getNvpUrl() {
    return nvpUrl;
  }

  public String getCheckoutUrl() {
    return checkoutUrl;
  }

  public static PayPalEnvironment of(boolean sandbox) {
    return sandbox ? SANDBOX : PRODUCTION;
  }
}
