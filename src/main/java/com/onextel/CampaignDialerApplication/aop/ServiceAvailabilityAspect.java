package com.onextel.CampaignDialerApplication.aop;

import com.onextel.CampaignDialerApplication.common.shutdown.ServiceLifecycle;
import com.onextel.CampaignDialerApplication.exception.ServiceShuttingDownException;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.springframework.stereotype.Component;

@Aspect
@Component
public class ServiceAvailabilityAspect {

    private final ServiceLifecycle serviceLifecycle;

    public ServiceAvailabilityAspect(ServiceLifecycle serviceLifecycle) {
        this.serviceLifecycle = serviceLifecycle;
    }

    @Before("@within(com.onextel.CampaignDialerApplication.aop.RequireServiceUp) || @annotation(com.onextel.CampaignDialerApplication.aop.RequireServiceUp)")
    public void checkServiceAvailability() {
        if (serviceLifecycle.isShuttingDown()) {
            throw new ServiceShuttingDownException("Service is currently shutting down");
        }
    }
}
