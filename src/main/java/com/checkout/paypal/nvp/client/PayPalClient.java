package com.checkout.paypal.nvp.client;

import com.checkout.paypal.nvp.enums.PaymentAction;
import com.checkout.paypal.nvp.model.PayPalDigitalGood;
import com.checkout.paypal.nvp.model.PayPalGood;
import com.checkout.paypal.nvp.model.PayPalOrder;
import com.checkout.paypal.nvp.model.PayPalResponse;
import java.util.List;
import org.springframework.util.MultiValueMap;

/**
 * Client for PayPal's name-value-pair (NVP) API, covering the Express Checkout flow:
 * set up a checkout, redirect the buyer to {@link PayPalResponse#getCheckoutUrl()}, read the
 * approved checkout back and finally execute the payment.
 *
 * <p>Every operation throws {@link com.checkout.paypal.nvp.exception.PayPalException} when
 * PayPal reports a failure in the reply body, whatever the HTTP status, and lets connection
 * and body-read failures ({@link org.springframework.web.client.ResourceAccessException})
 * propagate unchanged. Nothing is retried.
 */
public interface PayPalClient {

  /**
   * Sends a raw NVP call. The API credentials and version are added to a copy of
   * {@code values}; the caller's map is left untouched.
   *
   * @param values method-specific parameters, including {@code METHOD}
   * @return the decoded reply
   * @throws com.checkout.paypal.nvp.exception.PayPalException if the reply carries an error
   *     code or a failure ack
   * @throws com.checkout.paypal.nvp.exception.InvalidNvpResponseException if the reply body
   *     is not valid NVP
   */
  PayPalResponse performRequest(MultiValueMap<String, String> values);

  /**
   * Starts an Express Checkout for physical goods. A positive order discount is sent as a
   * trailing {@code DISCOUNT} line item.
   *
   * @param order totals, currency and redirect URLs
   * @param goods line items, in display order
   * @return the reply; its token identifies the checkout
   */
  PayPalResponse setExpressCheckout(PayPalOrder order, List<PayPalGood> goods);

  /**
   * Starts an Express Checkout for digital goods.
   *
   * @param paymentAmount the order total
   * @param currencyCode ISO currency code
   * @param returnUrl where PayPal sends the buyer after approval
   * @param cancelUrl where PayPal sends the buyer after cancelling
   * @param goods line items, in display order
   * @return the reply; its token identifies the checkout
   */
  PayPalResponse setExpressCheckoutDigitalGoods(double paymentAmount, String currencyCode,
      String returnUrl, String cancelUrl, List<PayPalDigitalGood> goods);

  /**
   * Executes the payment of an approved checkout.
   *
   * @param paymentType {@code Sale}, {@code Authorization} or {@code Order}; not validated
   */
  PayPalResponse doExpressCheckoutPayment(String token, String payerId, String paymentType,
      String currencyCode, double finalPaymentAmount);

  default PayPalResponse doExpressCheckoutPayment(String token, String payerId,
      PaymentAction paymentAction, String currencyCode, double finalPaymentAmount) {
    return doExpressCheckoutPayment(token, payerId, paymentAction.getValue(), currencyCode,
        finalPaymentAmount);
  }

  /** Charges an approved checkout immediately. */
  default PayPalResponse doExpressCheckoutSale(String token, String payerId,
      String currencyCode, double finalPaymentAmount) {
    return doExpressCheckoutPayment(token, payerId, PaymentAction.SALE, currencyCode,
        finalPaymentAmount);
  }

  /** Fetches the buyer and payment details of a checkout. */
  PayPalResponse getExpressCheckoutDetails(String token);
}
