package com.blogicum.auth.web;

import com.blogicum.auth.service.JwtService;
import com.blogicum.common.api.ApiCodes;
import com.blogicum.common.api.Result;
import com.blogicum.domain.policy.Viewer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 解析 accessToken，把访问者放进 request attribute {@link #REQ_ATTR_VIEWER}。
 *
 * <ul>
 *   <li>没有 Authorization 头：匿名访问者，放行（是否必须登录由 service 决定）</li>
 *   <li>Bearer token 有效：已登录访问者</li>
 *   <li>token 无效/过期：直接 401</li>
 * </ul>
 */
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_VIEWER = "X-Blog-Viewer";

    private static final Logger log = LoggerFactory.getLogger(AccessTokenInterceptor.class);

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            request.setAttribute(REQ_ATTR_VIEWER, Viewer.anonymous());
            return true;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            Jws<Claims> jws = jwtService.parseAccessToken(token);
            long accountId = jwtService.getAccountId(jws.getPayload());
            boolean staff = jwtService.isStaff(jws.getPayload());
            request.setAttribute(REQ_ATTR_VIEWER, Viewer.of(accountId, staff));
            return true;
        } catch (Exception e) {
            log.debug("reject access token: path={}, err={}", request.getRequestURI(), e.toString());
            response.setStatus(401);
            response.setCharacterEncoding("UTF-8");
            response.setContentType("application/json;charset=UTF-8");
            try {
                String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized"));
                response.getWriter().write(json);
            } catch (Exception writeErr) {
                log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
            }
            return false;
        }
    }

    /**
     * controller 取访问者；拦截器没跑到（例如被排除的路径）时按匿名处理。
     */
    public static Viewer viewerOf(HttpServletRequest request) {
        Object v = request == null ? null : request.getAttribute(REQ_ATTR_VIEWER);
        return v instanceof Viewer viewer ? viewer : Viewer.anonymous();
    }
}
