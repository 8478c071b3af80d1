package com.checkout.paypal.nvp.configuration;

import com.checkout.paypal.nvp.client.PayPalClient;
import com.checkout.paypal.nvp.client.NvpResponseErrorHandler;
import com.checkout.paypal.nvp.client.PayPalClientImpl;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Bean configuration for applications that embed the PayPal client.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@link RestTemplate} for PayPal calls, with connect/read timeouts from
 *       {@code paypal.connect-timeout-ms} and {@code paypal.read-timeout-ms}
 *       (10 seconds each by default); replies of any HTTP status are decoded as NVP</li>
 *   <li>{@link PayPalClient} built from {@code paypal.username}, {@code paypal.password},
 *       {@code paypal.signature} and {@code paypal.sandbox} (sandbox by default)</li>
 * </ul>
 */
@Configuration
public class PayPalClientConfiguration {

  @Bean
  public RestTemplate payPalRestTemplate(RestTemplateBuilder builder,
      @Value("${paypal.connect-timeout-ms:10000}") long connectTimeoutMs,
      @Value("${paypal.read-timeout-ms:10000}") long readTimeoutMs) {
    return builder
        .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
        .setReadTimeout(Duration.ofMillis(readTimeoutMs))
        .errorHandler(new NvpResponseErrorHandler())
        .build();
  }

  @Bean
  public PayPalClient payPalClient(
      @Qualifier("payPalRestTemplate") RestTemplate restTemplate,
      @Value("${paypal.username}") String username,
      @Value("${paypal.password}") String password,
      @Value("${paypal.signature}") String signature,
      @Value("${paypal.sandbox:true}") boolean sandbox) {
    return new PayPalClientImpl(username, password, signature, sandbox, restTemplate);
  }
}
