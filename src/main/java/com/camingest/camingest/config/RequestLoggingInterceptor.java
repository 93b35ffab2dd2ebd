package com.camingest.camingest.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingInterceptor.class);

    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    @Value("${logging.request.enabled:false}")
    private boolean enabled;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!enabled) {
            return true;
        }
        request.setAttribute(START_ATTRIBUTE, System.nanoTime());
        String handlerInfo = (handler instanceof HandlerMethod) ? ((HandlerMethod) handler).getShortLogMessage() : String.valueOf(handler);

        logger.info("Incoming request - method={}, uri={}, handler={}, remoteAddr={}",
                request.getMethod(), request.getRequestURI(), handlerInfo, request.getRemoteAddr());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        if (!enabled) {
            return;
        }
        Object start = request.getAttribute(START_ATTRIBUTE);
        long elapsedMs = start instanceof Long ? (System.nanoTime() - (Long) start) / 1_000_000 : -1;
        logger.info("Completed request - method={}, uri={}, status={}, elapsedMs={}",
                request.getMethod(), request.getRequestURI(), response.getStatus(), elapsedMs);
    }
}
