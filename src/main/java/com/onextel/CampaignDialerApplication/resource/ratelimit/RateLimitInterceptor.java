package com.onextel.CampaignDialerApplication.resource.ratelimit;

import com.onextel.CampaignDialerApplication.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {
    public static final String USER_HEADER = "X-User-Id";

    private final RateLimiter rateLimiter;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RateLimitPolicy policy = policyFor(handlerMethod);
        RateLimitDecision decision = rateLimiter.tryAcquire(policy,
                request.getHeader(USER_HEADER), clientAddress(request));

        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.getRemaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(decision.getResetSeconds()));

        if (!decision.isAllowed()) {
            throw new RateLimitExceededException(policy.getMessage(), decision.getResetSeconds());
        }
        return true;
    }

    private static RateLimitPolicy policyFor(HandlerMethod handlerMethod) {
        RateLimited annotation = handlerMethod.getMethodAnnotation(RateLimited.class);
        if (annotation == null) {
            annotation = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RateLimited.class);
        }
        return annotation == null ? RateLimitPolicy.API : annotation.value();
    }

    static String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
