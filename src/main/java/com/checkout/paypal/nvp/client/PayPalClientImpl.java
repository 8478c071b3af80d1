package com.checkout.paypal.nvp.client;

import com.checkout.paypal.nvp.enums.PayPalEnvironment;
import com.checkout.paypal.nvp.exception.PayPalException;
import com.checkout.paypal.nvp.model.PayPalDigitalGood;
import com.checkout.paypal.nvp.model.PayPalError;
import com.checkout.paypal.nvp.model.PayPalGood;
import com.checkout.paypal.nvp.model.PayPalOrder;
import com.checkout.paypal.nvp.model.PayPalResponse;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

/**
 * {@link PayPalClient} that posts form-encoded NVP calls with a {@link RestTemplate}.
 *
 * <p>Instances are immutable and safe to share between threads. The reply body is decoded
 * whatever its HTTP status, provided the {@link RestTemplate} uses an
 * {@link NvpResponseErrorHandler} (as {@link #defaultRestTemplate()} does); remote failures
 * become {@link PayPalException}. Connection and body-read errors raised by the
 * {@link RestTemplate} are not translated.
 *
 * <p>Log events:
 * <ul>
 *   <li>{@code paypal.request_sent} - method and environment</li>
 *   <li>{@code paypal.responded} - ack, correlation id and latency</li>
 *   <li>{@code paypal.failed} - error code and short message of a remote failure</li>
 * </ul>
 * Credentials are never logged.
 */
public class PayPalClientImpl implements PayPalClient {

  public static final String NVP_VERSION = "94";

  private static final Logger LOG = LoggerFactory.getLogger(PayPalClientImpl.class);

  private final String username;
  private final String password;
  private final String signature;
  private final PayPalEnvironment environment;
  private final RestTemplate restTemplate;

  public PayPalClientImpl(String username, String password, String signature,
      boolean sandbox) {
    this(username, password, signature, sandbox, defaultRestTemplate());
  }

  public PayPalClientImpl(String username, String password, String signature, boolean sandbox,
      RestTemplate restTemplate) {
    this.username = username;
    this.password = password;
    this.signature = signature;
    this.environment = PayPalEnvironment.of(sandbox);
    this.restTemplate = restTemplate;
  }

  @Override
  public PayPalResponse performRequest(MultiValueMap<String, String> values) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>(values).deepCopy();
    form.add("USER", username);
    form.add("PWD", password);
    form.add("SIGNATURE", signature);
    form.add("VERSION", NVP_VERSION);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

    String method = values.getFirst("METHOD");
    LOG.info("event=paypal.request_sent method={} environment={}", method, environment);

    long start = System.currentTimeMillis();
    MultiValueMap<String, String> responseValues = restTemplate.execute(
        environment.getNvpUrl(),
        HttpMethod.POST,
        restTemplate.httpEntityCallback(new HttpEntity<>(form, headers)),
        reply -> {
          LOG.debug("event=paypal.http_status method={} status={}", method,
              reply.getStatusCode().value());
          return NvpFormat.read(reply);
        });
    long duration = System.currentTimeMillis() - start;

    PayPalResponse response = new PayPalResponse(responseValues, environment);

    LOG.info("event=paypal.responded method={} ack={} correlationId={} latencyMs={}",
        method, response.getAck(), response.getCorrelationId(), duration);

    Optional<PayPalError> error = PayPalError.fromValues(responseValues);
    if (error.isPresent()) {
      LOG.warn("event=paypal.failed method={} ack={} errorCode={} shortMessage={} "
              + "correlationId={}", method, error.get().getAck(), error.get().getErrorCode(),
          error.get().getShortMessage(), response.getCorrelationId());
      throw new PayPalException(error.get(), response);
    }
    return response;
  }

  @Override
  public PayPalResponse setExpressCheckout(PayPalOrder order, List<PayPalGood> goods) {
    return performRequest(NvpRequestFactory.setExpressCheckout(order, goods));
  }

  @Override
  public PayPalResponse setExpressCheckoutDigitalGoods(double paymentAmount,
      String currencyCode, String returnUrl, String cancelUrl, List<PayPalDigitalGood> goods) {
    return performRequest(NvpRequestFactory.setExpressCheckoutDigitalGoods(paymentAmount,
        currencyCode, returnUrl, cancelUrl, goods));
  }

  @Override
  public PayPalResponse doExpressCheckoutPayment(String token, String payerId,
      String paymentType, String currencyCode, double finalPaymentAmount) {
    return performRequest(NvpRequestFactory.doExpressCheckoutPayment(token, payerId,
        paymentType, currencyCode, finalPaymentAmount));
  }

  @Override
  public PayPalResponse getExpressCheckoutDetails(String token) {
    return performRequest(NvpRequestFactory.getExpressCheckoutDetails(token));
  }

  /** A {@link RestTemplate} that hands replies of any HTTP status to the NVP decoder. */
  public static RestTemplate defaultRestTemplate() {
    RestTemplate restTemplate = new RestTemplate();
    restTemplate.setErrorHandler(new NvpResponseErrorHandler());
    return restTemplate;
  }

  public PayPalEnvironment getEnvironment() {
    return environment;
  }
}
