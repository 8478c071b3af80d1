package com.checkout.paypal.nvp.client;

import com.checkout.paypal.nvp.enums.PaymentAction;
import com.checkout.paypal.nvp.model.PayPalDigitalGood;
import com.checkout.paypal.nvp.model.PayPalGood;
import com.checkout.paypal.nvp.model.PayPalOrder;
import java.util.List;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

/**
 * Builds the method-specific parameters of each NVP call. Credentials and the API version
 * are added later by {@link PayPalClientImpl#performRequest(MultiValueMap)}.
 *
 * <p>Every Express Checkout set up here is a final sale with no shipping address:
 * {@code PAYMENTACTION=Sale}, {@code SOLUTIONTYPE=Sole}, {@code REQCONFIRMSHIPPING=0}
 * and {@code NOSHIPPING=1}.
 */
public final class NvpRequestFactory {

  static final String ITEM_NAME = "L_PAYMENTREQUEST_0_NAME";
  static final String ITEM_AMOUNT = "L_PAYMENTREQUEST_0_AMT";
  static final String ITEM_QUANTITY = "L_PAYMENTREQUEST_0_QTY";
  static final String ITEM_NUMBER = "L_PAYMENTREQUEST_0_NUMBER";
  static final String ITEM_CATEGORY = "L_PAYMENTREQUEST_0_ITEMCATEGORY";

  private NvpRequestFactory() {
  }

  public static MultiValueMap<String, String> setExpressCheckout(PayPalOrder order,
      List<PayPalGood> goods) {
    MultiValueMap<String, String> values = new LinkedMultiValueMap<>();
    values.set("METHOD", "SetExpressCheckout");
    values.add("PAYMENTREQUEST_0_ITEMAMT", NvpFormat.formatAmount(order.getSubTotal()));
    values.add("PAYMENTREQUEST_0_SHIPPINGAMT", NvpFormat.formatAmount(order.getShipping()));
    values.add("PAYMENTREQUEST_0_AMT", NvpFormat.formatAmount(order.getTotal()));
    addCheckoutOptions(values, order.getCurrencyCode(), order.getReturnUrl(),
        order.getCancelUrl());

    for (int i = 0; i < goods.size(); i++) {
      PayPalGood good = goods.get(i);
      if (StringUtils.hasLength(good.getId())) {
        values.add(ITEM_NUMBER + i, good.getId());
      }
      addItem(values, i, good.getName(), good.getAmount(), String.valueOf(good.getQuantity()));
    }

    if (order.getDiscount() > 0) {
      addItem(values, goods.size(), "DISCOUNT", -order.getDiscount(), "1");
    }
    return values;
  }

  public static MultiValueMap<String, String> setExpressCheckoutDigitalGoods(
      double paymentAmount, String currencyCode, String returnUrl, String cancelUrl,
      List<PayPalDigitalGood> goods) {
    MultiValueMap<String, String> values = new LinkedMultiValueMap<>();
    values.set("METHOD", "SetExpressCheckout");
    values.add("PAYMENTREQUEST_0_AMT", NvpFormat.formatAmount(paymentAmount));
    addCheckoutOptions(values, currencyCode, returnUrl, cancelUrl);

    for (int i = 0; i < goods.size(); i++) {
      PayPalDigitalGood good = goods.get(i);
      addItem(values, i, good.getName(), good.getAmount(), String.valueOf(good.getQuantity()));
      values.add(ITEM_CATEGORY + i, "Digital");
    }
    return values;
  }

  /**
   * @param paymentType {@code Sale}, {@code Authorization} or {@code Order}; sent as given
   */
  public static MultiValueMap<String, String> doExpressCheckoutPayment(String token,
      String payerId, String paymentType, String currencyCode, double finalPaymentAmount) {
    MultiValueMap<String, String> values = new LinkedMultiValueMap<>();
    values.set("METHOD", "DoExpressCheckoutPayment");
    values.add("TOKEN", token);
    values.add("PAYERID", payerId);
    values.add("PAYMENTREQUEST_0_PAYMENTACTION", paymentType);
    values.add("PAYMENTREQUEST_0_CURRENCYCODE", currencyCode);
    values.add("PAYMENTREQUEST_0_AMT", NvpFormat.formatAmount(finalPaymentAmount));
    return values;
  }

  public static MultiValueMap<String, String> getExpressCheckoutDetails(String token) {
    MultiValueMap<String, String> values = new LinkedMultiValueMap<>();
    values.set("METHOD", "GetExpressCheckoutDetails");
    values.add("TOKEN", token);
    return values;
  }

  private static void addCheckoutOptions(MultiValueMap<String, String> values,
      String currencyCode, String returnUrl, String cancelUrl) {
    values.add("PAYMENTREQUEST_0_PAYMENTACTION", PaymentAction.SALE.getValue());
    values.add("PAYMENTREQUEST_0_CURRENCYCODE", currencyCode);
    values.add("RETURNURL", returnUrl);
    values.add("CANCELURL", cancelUrl);
    values.add("REQCONFIRMSHIPPING", "0");
    values.add("NOSHIPPING", "1");
    values.add("SOLUTIONTYPE", "Sole");
  }

  private static void addItem(MultiValueMap<String, String> values, int index, String name,
      double amount, String quantity) {
    values.add(ITEM_NAME + index, name);
    values.add(ITEM_AMOUNT + index, NvpFormat.formatAmount(amount));
    values.add(ITEM_QUANTITY + index, quantity);
  }
}
