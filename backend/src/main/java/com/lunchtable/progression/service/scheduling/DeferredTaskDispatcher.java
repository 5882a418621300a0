package com.lunchtable.progression.service.scheduling;

import com.lunchtable.progression.service.NotificationService;
import com.lunchtable.progression.service.PurchaseConfirmationWorkflow;
import com.lunchtable.progression.service.TokenBalanceService;
import com.lunchtable.progression.service.events.DomainEventRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes a decoded deferred task to the service that owns it. Shared by the outbox worker and the
 * Redis queue consumer.
 */
@Component
@RequiredArgsConstructor
public class DeferredTaskDispatcher {

    private final PurchaseConfirmationWorkflow purchaseConfirmationWorkflow;
    private final DomainEventRouter domainEventRouter;
    private final TokenBalanceService tokenBalanceService;
    private final NotificationService notificationService;

    public void dispatch(DeferredTask task) {
        if (task instanceof DeferredTask.PollPurchaseConfirmation poll) {
            purchaseConfirmationWorkflow.poll(poll);
        } else if (task instanceof DeferredTask.DispatchDomainEvent dispatchEvent) {
            domainEventRouter.dispatchEnvelope(dispatchEvent.kind(), dispatchEvent.payload());
        } else if (task instanceof DeferredTask.RefreshTokenBalance refresh) {
            tokenBalanceService.refresh(refresh);
        } else if (task instanceof DeferredTask.NotifyPlayer notify) {
            notificationService.deliver(notify);
        } else {
            throw new IllegalArgumentException("Unsupported deferred task: " + task.taskType());
        }
    }
}
