package com.onextel.CampaignDialerApplication.resource.ratelimit;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Selects the limiter policy for a controller method or class. Unannotated handlers use {@link RateLimitPolicy#API}.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {
    RateLimitPolicy value();
}
