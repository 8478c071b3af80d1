package com.checkout.paypal.nvp.client;

import com.checkout.paypal.nvp.exception.InvalidNvpResponseException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.util.MultiValueMap;

/**
 * Encoding rules of the NVP wire format shared by requests and replies.
 */
public final class NvpFormat {

  // PayPal answers with text/plain bodies in form encoding
  private static final FormHttpMessageConverter CONVERTER = new FormHttpMessageConverter();

  static {
    CONVERTER.setSupportedMediaTypes(
        List.of(MediaType.APPLICATION_FORM_URLENCODED, MediaType.TEXT_PLAIN));
  }

  private NvpFormat() {
  }

  /**
   * Formats an amount with exactly two decimal places, rounding the exact binary value
   * half-even, e.g. {@code 19.9 -> "19.90"} and {@code 1.005 -> "1.00"}.
   */
  public static String formatAmount(double amount) {
    return new BigDecimal(amount).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
  }

  /**
   * Decodes a reply body of the form {@code KEY=value&KEY2=value2}. Keys and values are
   * URL-decoded ({@code +} is a space); a pair without {@code =} maps to an empty value and
   * repeated keys keep every value in order.
   *
   * @param message the reply; an empty body yields an empty map
   * @return the decoded fields
   * @throws IOException if the body cannot be read
   * @throws InvalidNvpResponseException if the body contains an invalid percent escape
   */
  @SuppressWarnings("unchecked")
  public static MultiValueMap<String, String> read(HttpInputMessage message) throws IOException {
    MultiValueMap<String, String> values;
    try {
      values = (MultiValueMap<String, String>) CONVERTER.read(null, message);
    } catch (IllegalArgumentException e) {
      throw new InvalidNvpResponseException("Malformed NVP response: " + e.getMessage(), e);
    }
    values.values().forEach(list -> list.replaceAll(value -> value == null ? "" : value));
    return values;
  }
}
