package com.policyframe.starter.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.PolicyFrameException;
import com.policyframe.api.route.RouteDirective;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerExecutionChain;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 路由策略过滤器
 * <p>
 * 只处理声明了 {@link com.policyframe.starter.annotation.RoutePolicies} 的 Controller 请求：
 * 1. 处理器之前执行 onRequest 到 onPreHandler
 * 2. 处理器的响应先缓存，之后执行 onPostHandler 和 onPreResponse
 * 3. 被拒绝或配置错误时以 JSON 输出错误；策略自身抛出的错误交给容器
 */
@Slf4j
@RequiredArgsConstructor
public class PolicyWebFilter extends OncePerRequestFilter {

    static final List<ApplyPoint> BEFORE_HANDLER = List.of(
            ApplyPoint.ON_REQUEST, ApplyPoint.ON_PRE_AUTH, ApplyPoint.ON_POST_AUTH, ApplyPoint.ON_PRE_HANDLER);
    static final List<ApplyPoint> AFTER_HANDLER = List.of(
            ApplyPoint.ON_POST_HANDLER, ApplyPoint.ON_PRE_RESPONSE);

    private final SpringPolicyHost host;
    private final RoutePolicyIndex routePolicyIndex;
    private final RequestMappingHandlerMapping requestMappingHandlerMapping;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain)
            throws ServletException, IOException {

        // 1. 解析 HandlerMethod 和路由声明
        HandlerMethod handlerMethod = resolveHandlerMethod(request);
        List<RouteDirective> directives;
        try {
            directives = handlerMethod != null ? routePolicyIndex.find(handlerMethod) : null;
        } catch (PolicyFrameException e) {
            // 启动后才出现的路由在此首次声明，声明非法时按配置错误输出
            log.error("Invalid route policies on {}: {}", handlerMethod, e.getMessage());
            writeError(response, new SpringPolicyRequest(request, null), e);
            return;
        }
        if (directives == null) {
            filterChain.doFilter(request, response);
            return;
        }

        // 2. 处理器之前的挂载点
        SpringPolicyRequest policyRequest = new SpringPolicyRequest(request, directives);
        Throwable error = host.runStages(BEFORE_HANDLER, policyRequest);
        if (error != null) {
            reject(response, policyRequest, error);
            return;
        }

        // 3. 处理器，响应先缓存
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        filterChain.doFilter(request, wrapper);

        // 4. 处理器之后的挂载点，失败时丢弃处理器的响应
        error = host.runStages(AFTER_HANDLER, policyRequest);
        if (error != null) {
            if (!response.isCommitted()) {
                wrapper.reset();
            }
            reject(wrapper, policyRequest, error);
        }
        wrapper.copyBodyToResponse();
    }

    /**
     * 解析请求对应的 HandlerMethod
     */
    private HandlerMethod resolveHandlerMethod(HttpServletRequest request) {
        try {
            HandlerExecutionChain chain = requestMappingHandlerMapping.getHandler(request);
            if (chain != null && chain.getHandler() instanceof HandlerMethod hm) {
                return hm;
            }
        } catch (Exception e) {
            log.debug("Failed to resolve handler for {}: {}", request.getRequestURI(), e.getMessage());
        }
        return null;
    }

    private void reject(HttpServletResponse response, SpringPolicyRequest request, Throwable error)
            throws ServletException, IOException {
        if (error instanceof PolicyFrameException pfe) {
            log.debug("Request {} {} rejected: {} {}", request.getMethod(), request.getPath(),
                    pfe.getStatusCode(), pfe.getMessage());
            writeError(response, request, pfe);
            return;
        }

        // 策略自身的错误原样交给容器
        if (error instanceof ServletException se) {
            throw se;
        }
        if (error instanceof IOException ioe) {
            throw ioe;
        }
        if (error instanceof RuntimeException re) {
            throw re;
        }
        if (error instanceof Error e) {
            throw e;
        }
        throw new ServletException(error);
    }

    private void writeError(HttpServletResponse response, SpringPolicyRequest request, PolicyFrameException error)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", error.getStatusCode());
        body.put("error", error.getKind().name());
        body.put("message", error.getMessage());
        body.put("path", request.getPath());

        byte[] content = objectMapper.writeValueAsBytes(body);
        response.setStatus(error.getStatusCode());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentLength(content.length);
        response.getOutputStream().write(content);
    }
}
