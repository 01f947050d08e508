/*
 * Where: web configuration
 * What: applies RequestMdcInterceptor to every request and sizes the async timeout for SSE
 * Why: API logs carry the operational keys, and streams are closed by the client, not by a timer
 */
package com.fiveschedule.notification.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }

  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    // -1: no container timeout; SseEmitter(0L) already opts out per stream
    configurer.setDefaultTimeout(-1);
  }
}
