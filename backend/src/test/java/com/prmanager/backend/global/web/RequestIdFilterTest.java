package com.prmanager.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("전달받은 요청 id를 응답 헤더와 MDC에 그대로 쓴다")
    void propagatesIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/prs/1");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse resp) {
                seenInMdc.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        }));

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(seenInMdc.get()).isEqualTo("abc-123");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("헤더가 없거나 너무 길면 새 id를 만든다")
    void generatesIdWhenMissingOrTooLong() {
        MockHttpServletRequest missing = new MockHttpServletRequest("GET", "/stats");
        MockHttpServletRequest tooLong = new MockHttpServletRequest("GET", "/stats");
        tooLong.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "x".repeat(129));

        assertThat(RequestIdFilter.resolveRequestId(missing)).isNotBlank();
        assertThat(RequestIdFilter.resolveRequestId(tooLong)).hasSizeLessThanOrEqualTo(128);
    }
}
