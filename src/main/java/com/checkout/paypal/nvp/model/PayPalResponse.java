package com.checkout.paypal.nvp.model;

import com.checkout.paypal.nvp.enums.PayPalEnvironment;
import org.springframework.util.CollectionUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Decoded reply of a PayPal NVP call.
 *
 * <p>The common reply fields are promoted to getters; every other field (payer details,
 * payment info, error lists) stays available through {@link #getValues()} and
 * {@link #getValue(String)}.
 *
 * <p>The response remembers the {@link PayPalEnvironment} that served it, so
 * {@link #getCheckoutUrl()} always points the buyer at the matching checkout page.
 */
public class PayPalResponse {

  private final String ack;
  private final String correlationId;
  private final String timestamp;
  private final String version;
  private final String build;
  private final String token;
  private final MultiValueMap<String, String> values;
  private final PayPalEnvironment environment;

  public PayPalResponse(MultiValueMap<String, String> values, PayPalEnvironment environment) {
    this.values = CollectionUtils.unmodifiableMultiValueMap(
        new LinkedMultiValueMap<>(values).deepCopy());
    this.environment = environment;
    this.ack = values.getFirst("ACK");
    this.correlationId = values.getFirst("CORRELATIONID");
    this.timestamp = values.getFirst("TIMESTAMP");
    this.version = values.getFirst("VERSION");
    this.build = values.getFirst("BUILD");
    this.token = values.getFirst("TOKEN");
  }

  /**
   * Builds the URL the buyer is redirected to in order to approve the payment.
   *
   * @return the checkout page of this response's environment with
   *     {@code cmd=_express-checkout} and this response's token
   */
  public String getCheckoutUrl() {
    return UriComponentsBuilder.fromUriString(environment.getCheckoutUrl())
        .queryParam("cmd", "_express-checkout")
        .queryParam("token", "{token}")
        .encode()
        .buildAndExpand(token == null ? "" : token)
        .toUriString();
  }

  /** Projects the {@code PAYMENTINFO_0_*} fields of this response. */
  public PayPalPaymentResponse toPaymentResponse() {
    PayPalPaymentResponse paymentResponse = new PayPalPaymentResponse();
    paymentResponse.populate(values);
    return paymentResponse;
  }

  /** Returns the first value of the given field, or {@code null} if PayPal did not send it. */
  public String getValue(String name) {
    return values.getFirst(name);
  }

  public String getAck() {
    return ack;
  }

  public String getCorrelationId() {
    return correlationId;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public String getVersion() {
    return version;
  }

  public String getBuild() {
    return build;
  }

  public String getToken() {
    return token;
  }

  public MultiValueMap<String, String> getValues() {
    return values;
  }

  public PayPalEnvironment getEnvironment() {
    return environment;
  }
}
