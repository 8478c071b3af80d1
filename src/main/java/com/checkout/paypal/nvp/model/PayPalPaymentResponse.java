package com.checkout.paypal.nvp.model;

import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

/**
 * Payment details of the first payment in a {@code DoExpressCheckoutPayment} reply.
 *
 * <p>Amount fields are parsed leniently: a missing or non-numeric amount (including
 * surrounding whitespace or a type suffix such as {@code 10d}) is read as {@code 0} instead
 * of failing the whole projection.
 */
public class PayPalPaymentResponse {

  private static final Logger LOG = LoggerFactory.getLogger(PayPalPaymentResponse.class);

  private String transactionId;
  private String status;
  private String type;
  private double fee;
  private double amount;
  private String currency;
  private String reasonCode;

  /**
   * Copies the {@code PAYMENTINFO_0_*} fields of a raw NVP reply into this object.
   *
   * @param values the raw reply fields
   */
  public void populate(MultiValueMap<String, String> values) {
    transactionId = values.getFirst("PAYMENTINFO_0_TRANSACTIONID");
    status = values.getFirst("PAYMENTINFO_0_PAYMENTSTATUS");
    amount = parseAmount("PAYMENTINFO_0_AMT", values.getFirst("PAYMENTINFO_0_AMT"));
    fee = parseAmount("PAYMENTINFO_0_FEEAMT", values.getFirst("PAYMENTINFO_0_FEEAMT"));
    currency = values.getFirst("PAYMENTINFO_0_CURRENCYCODE");
    type = values.getFirst("PAYMENTINFO_0_PAYMENTTYPE");
    reasonCode = values.getFirst("PAYMENTINFO_0_REASONCODE");
  }

  private static double parseAmount(String field, String value) {
    if (!StringUtils.hasText(value)) {
      return 0;
    }
    try {
      return new BigDecimal(value).doubleValue();
    } catch (NumberFormatException e) {
      LOG.debug("Unparseable amount in {}: '{}', using 0", field, value);
      return 0;
    }
  }

  public String getTransactionId() {
    return transactionId;
  }

  public String getStatus() {
    return status;
  }

  public String getType() {
    return type;
  }

  public double getFee() {
    return fee;
  }

  public double getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public String getReasonCode() {
    return reasonCode;
  }
}
