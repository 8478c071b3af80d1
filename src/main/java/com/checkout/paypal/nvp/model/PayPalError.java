package com.checkout.paypal.nvp.model;

import java.util.Optional;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

/**
 * Failure reported by PayPal in an NVP reply.
 *
 * <p>Only the first entry of PayPal's error list ({@code L_*0}) is captured; the full list
 * remains available in {@link PayPalResponse#getValues()}.
 */
public class PayPalError {

  static final String MAINTENANCE_MESSAGE =
      "PayPal is undergoing maintenance.\nPlease try again later.";

  private final String ack;
  private final String errorCode;
  private final String shortMessage;
  private final String longMessage;
  private final String severityCode;

  public PayPalError(String ack, String errorCode, String shortMessage, String longMessage,
      String severityCode) {
    this.ack = ack;
    this.errorCode = errorCode;
    this.shortMessage = shortMessage;
    this.longMessage = longMessage;
    this.severityCode = severityCode;
  }

  /**
   * Extracts the error from a raw reply. A reply is a failure when it carries
   * {@code L_ERRORCODE0} or when its {@code ACK} is {@code Failure} or
   * {@code FailureWithWarning} (case-insensitive).
   *
   * @param values the raw reply fields
   * @return the error, or empty if the reply is not a failure
   */
  public static Optional<PayPalError> fromValues(MultiValueMap<String, String> values) {
    String ack = values.getFirst("ACK");
    String errorCode = values.getFirst("L_ERRORCODE0");
    if (!StringUtils.hasLength(errorCode)
        && !"failure".equalsIgnoreCase(ack)
        && !"failurewithwarning".equalsIgnoreCase(ack)) {
      return Optional.empty();
    }
    return Optional.of(new PayPalError(
        ack,
        errorCode,
        values.getFirst("L_SHORTMESSAGE0"),
        values.getFirst("L_LONGMESSAGE0"),
        values.getFirst("L_SEVERITYCODE0")));
  }

  /**
   * Human-readable summary: the error code and short message when both are present,
   * otherwise the ack, otherwise a maintenance notice.
   */
  public String getMessage() {
    if (StringUtils.hasLength(errorCode) && StringUtils.hasLength(shortMessage)) {
      return "PayPal Error " + errorCode + ": " + shortMessage;
    }
    if (StringUtils.hasLength(ack)) {
      return ack;
    }
    return MAINTENANCE_MESSAGE;
  }

  public String getAck() {
    return ack;
  }

  public String getErrorCode() {
    return errorCode;
  }

  public String getShortMessage() {
    return shortMessage;
  }

  public String getLongMessage() {
    return longMessage;
  }

  public String getSeverityCode() {
    return severityCode;
  }

  @Override
  public String toString() {
    return getMessage();
  }
}
