package com.example.chatstream.config;

import com.example.chatstream.util.RequestIdHolder;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void reusesClientRequestIdAndEchoesIt() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/chat/stream");
        request.addHeader(RequestIdFilter.HEADER, "cliente-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, capturing(seen));

        assertEquals("cliente-1", seen.get());
        assertEquals("cliente-1", response.getHeader(RequestIdFilter.HEADER));
        assertNull(RequestIdHolder.get());
    }

    @Test
    void asyncDispatchKeepsTheIdOfTheRequestThatOpenedTheStream() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/chat/stream");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> opened = new AtomicReference<>();
        filter.doFilter(request, response, capturing(opened));
        assertNotNull(opened.get());

        request.setDispatcherType(DispatcherType.ASYNC);
        MockHttpServletResponse asyncResponse = new MockHttpServletResponse();
        AtomicReference<String> closed = new AtomicReference<>();
        filter.doFilter(request, asyncResponse, capturing(closed));

        assertEquals(opened.get(), closed.get());
        assertNull(asyncResponse.getHeader(RequestIdFilter.HEADER));
    }

    private static FilterChain capturing(AtomicReference<String> seen) {
        return (req, res) -> seen.set(RequestIdHolder.get());
    }
}
