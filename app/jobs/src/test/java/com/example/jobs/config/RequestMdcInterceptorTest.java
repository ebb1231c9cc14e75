package com.example.jobs.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("PUT", "/jobs/events/order-created");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("type", "order-created"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("PUT");
    assertThat(MDC.get("http_path")).isEqualTo("/jobs/events/order-created");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("event_type")).isEqualTo("order-created");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("event_type")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderIsMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/jobs/health");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("event_type")).isNull();
  }
}
