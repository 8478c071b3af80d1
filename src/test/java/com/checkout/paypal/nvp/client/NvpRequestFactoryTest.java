package com.checkout.paypal.nvp.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.checkout.paypal.nvp.model.PayPalDigitalGood;
import com.checkout.paypal.nvp.model.PayPalGood;
import com.checkout.paypal.nvp.model.PayPalOrder;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.util.MultiValueMap;

@DisplayName("NvpRequestFactory")
class NvpRequestFactoryTest {

  private PayPalOrder order(double discount) {
    PayPalOrder order = new PayPalOrder();
    order.setSubTotal(30);
    order.setShipping(4.5);
    order.setDiscount(discount);
    order.setTotal(34.5 - discount);
    order.setCurrencyCode("USD");
    order.setReturnUrl("https://shop.example.com/return");
    order.setCancelUrl("https://shop.example.com/cancel");
    return order;
  }

  private List<PayPalGood> goods() {
    return List.of(
        new PayPalGood("SKU-1", "T-shirt", 10, 2),
        new PayPalGood(null, "Sticker", 5, 2),
        new PayPalGood("", "Poster", 0, 1));
  }

  private long countFieldsStartingWith(MultiValueMap<String, String> values, String prefix) {
    return values.keySet().stream().filter(key -> key.startsWith(prefix)).count();
  }

  @Nested
  @DisplayName("SetExpressCheckout")
  class SetExpressCheckout {

    @Test
    @DisplayName("Should set method, totals and fixed checkout options")
    void shouldSetMethodTotalsAndOptions() {
      // when
      MultiValueMap<String, String> values =
          NvpRequestFactory.setExpressCheckout(order(0), goods());

      // then
      assertEquals("SetExpressCheckout", values.getFirst("METHOD"));
      assertEquals("30.00", values.getFirst("PAYMENTREQUEST_0_ITEMAMT"));
      assertEquals("4.50", values.getFirst("PAYMENTREQUEST_0_SHIPPINGAMT"));
      assertEquals("34.50", values.getFirst("PAYMENTREQUEST_0_AMT"));
      assertEquals("Sale", values.getFirst("PAYMENTREQUEST_0_PAYMENTACTION"));
      assertEquals("USD", values.getFirst("PAYMENTREQUEST_0_CURRENCYCODE"));
      assertEquals("https://shop.example.com/return", values.getFirst("RETURNURL"));
      assertEquals("https://shop.example.com/cancel", values.getFirst("CANCELURL"));
      assertEquals("0", values.getFirst("REQCONFIRMSHIPPING"));
      assertEquals("1", values.getFirst("NOSHIPPING"));
      assertEquals("Sole", values.getFirst("SOLUTIONTYPE"));
    }

    @Test
    @DisplayName("Should emit one contiguous 0-based name field per line item")
    void shouldEmitContiguousItemFields() {
      // when
      MultiValueMap<String, String> values =
          NvpRequestFactory.setExpressCheckout(order(0), goods());

      // then
      assertEquals(3, countFieldsStartingWith(values, "L_PAYMENTREQUEST_0_NAME"));
      assertEquals("T-shirt", values.getFirst("L_PAYMENTREQUEST_0_NAME0"));
      assertEquals("Sticker", values.getFirst("L_PAYMENTREQUEST_0_NAME1"));
      assertEquals("Poster", values.getFirst("L_PAYMENTREQUEST_0_NAME2"));
      assertEquals("10.00", values.getFirst("L_PAYMENTREQUEST_0_AMT0"));
      assertEquals("0.00", values.getFirst("L_PAYMENTREQUEST_0_AMT2"));
      assertEquals("2", values.getFirst("L_PAYMENTREQUEST_0_QTY1"));
    }

    @Test
    @DisplayName("Should emit item number only when the good has an id")
    void shouldEmitItemNumber_onlyWhenIdPresent() {
      // when
      MultiValueMap<String, String> values =
          NvpRequestFactory.setExpressCheckout(order(0), goods());

      // then
      assertEquals("SKU-1", values.getFirst("L_PAYMENTREQUEST_0_NUMBER0"));
      assertFalse(values.containsKey("L_PAYMENTREQUEST_0_NUMBER1"));
      assertFalse(values.containsKey("L_PAYMENTREQUEST_0_NUMBER2"));
      assertEquals(0, countFieldsStartingWith(values, "L_PAYMENTREQUEST_0_ITEMCATEGORY"));
    }

    @Test
    @DisplayName("Should append a single DISCOUNT line after the goods when discount is positive")
    void shouldAppendDiscountLine_whenDiscountPositive() {
      // when
      MultiValueMap<String, String> values =
          NvpRequestFactory.setExpressCheckout(order(7.25), goods());

      // then
      assertEquals(4, countFieldsStartingWith(values, "L_PAYMENTREQUEST_0_NAME"));
      assertEquals("DISCOUNT", values.getFirst("L_PAYMENTREQUEST_0_NAME3"));
      assertEquals("-7.25", values.getFirst("L_PAYMENTREQUEST_0_AMT3"));
      assertEquals("1", values.getFirst("L_PAYMENTREQUEST_0_QTY3"));
      assertFalse(values.containsKey("L_PAYMENTREQUEST_0_NUMBER3"));
    }

    @Test
    @DisplayName("Should not append a DISCOUNT line when discount is zero or negative")
    void shouldNotAppendDiscountLine_whenDiscountNotPositive() {
      // when
      MultiValueMap<String, String> zero =
          NvpRequestFactory.setExpressCheckout(order(0), goods());
      MultiValueMap<String, String> negative =
          NvpRequestFactory.setExpressCheckout(order(-3), goods());

      // then
      assertFalse(zero.containsKey("L_PAYMENTREQUEST_0_NAME3"));
      assertFalse(negative.containsKey("L_PAYMENTREQUEST_0_NAME3"));
    }

    @Test
    @DisplayName("Should put the DISCOUNT line at index 0 when there are no goods")
    void shouldPutDiscountAtIndexZero_whenNoGoods() {
      // when
      MultiValueMap<String, String> values =
          NvpRequestFactory.setExpressCheckout(order(2), Collections.emptyList());

      // then
      assertEquals(1, countFieldsStartingWith(values, "L_PAYMENTREQUEST_0_NAME"));
      assertEquals("DISCOUNT", values.getFirst("L_PAYMENTREQUEST_0_NAME0"));
      assertEquals("-2.00", values.getFirst("L_PAYMENTREQUEST_0_AMT0"));
    }
  }

  @Nested
  @DisplayName("SetExpressCheckout for digital goods")
  class SetExpressCheckoutDigitalGoods {

    @Test
    @DisplayName("Should mark every line item as Digital")
    void shouldMarkItemsDigital() {
      // given
      List<PayPalDigitalGood> goods = List.of(
          new PayPalDigitalGood("E-book", 12.5, 1),
          new PayPalDigitalGood("Song", 0.99, 3));

      // when
      MultiValueMap<String, String> values = NvpRequestFactory.setExpressCheckoutDigitalGoods(
          15.47, "EUR", "https://r", "https://c", goods);

      // then
      assertEquals("SetExpressCheckout", values.getFirst("METHOD"));
      assertEquals("15.47", values.getFirst("PAYMENTREQUEST_0_AMT"));
      assertEquals("EUR", values.getFirst("PAYMENTREQUEST_0_CURRENCYCODE"));
      assertEquals("Sole", values.getFirst("SOLUTIONTYPE"));
      assertEquals("1", values.getFirst("NOSHIPPING"));
      assertEquals("E-book", values.getFirst("L_PAYMENTREQUEST_0_NAME0"));
      assertEquals("12.50", values.getFirst("L_PAYMENTREQUEST_0_AMT0"));
      assertEquals("0.99", values.getFirst("L_PAYMENTREQUEST_0_AMT1"));
      assertEquals("3", values.getFirst("L_PAYMENTREQUEST_0_QTY1"));
      assertEquals("Digital", values.getFirst("L_PAYMENTREQUEST_0_ITEMCATEGORY0"));
      assertEquals("Digital", values.getFirst("L_PAYMENTREQUEST_0_ITEMCATEGORY1"));
      assertFalse(values.containsKey("PAYMENTREQUEST_0_ITEMAMT"));
    }

    @Test
    @DisplayName("Should emit no line items for an empty list")
    void shouldEmitNoItems_whenGoodsEmpty() {
      // when
      MultiValueMap<String, String> values = NvpRequestFactory.setExpressCheckoutDigitalGoods(
          0, "USD", "https://r", "https://c", Collections.emptyList());

      // then
      assertEquals(0, countFieldsStartingWith(values, "L_"));
      assertEquals("0.00", values.getFirst("PAYMENTREQUEST_0_AMT"));
    }
  }

  @Nested
  @DisplayName("DoExpressCheckoutPayment and GetExpressCheckoutDetails")
  class PaymentAndDetails {

    @Test
    @DisplayName("Should pass the payment type through verbatim")
    void shouldPassPaymentTypeVerbatim() {
      // when
      MultiValueMap<String, String> values = NvpRequestFactory.doExpressCheckoutPayment(
          "EC-123", "PAYER-9", "SomethingElse", "GBP", 99.999);

      // then
      assertEquals("DoExpressCheckoutPayment", values.getFirst("METHOD"));
      assertEquals("EC-123", values.getFirst("TOKEN"));
      assertEquals("PAYER-9", values.getFirst("PAYERID"));
      assertEquals("SomethingElse", values.getFirst("PAYMENTREQUEST_0_PAYMENTACTION"));
      assertEquals("GBP", values.getFirst("PAYMENTREQUEST_0_CURRENCYCODE"));
      assertEquals("100.00", values.getFirst("PAYMENTREQUEST_0_AMT"));
    }

    @Test
    @DisplayName("Should send only method and token for details")
    void shouldSendOnlyToken_forDetails() {
      // when
      MultiValueMap<String, String> values =
          NvpRequestFactory.getExpressCheckoutDetails("EC-123");

      // then
      assertEquals(2, values.size());
      assertEquals("GetExpressCheckoutDetails", values.getFirst("METHOD"));
      assertEquals("EC-123", values.getFirst("TOKEN"));
      assertNull(values.getFirst("PAYERID"));
      assertTrue(values.containsKey("TOKEN"));
    }
  }
}
